package com.genderai.server.artifact;

/**
 * Raised when the model file set cannot be copied out of the artifact store.
 * Always names the first file that could not be fetched.
 */
public class FetchException extends Exception {

    public enum Kind {
        MISSING_FILE,
        NETWORK_ERROR,
        PERMISSION_ERROR
    }

    private final Kind kind;
    private final String fileName;

    public FetchException(Kind kind, String fileName, String message) {
        this(kind, fileName, message, null);
    }

    public FetchException(Kind kind, String fileName, String message, Throwable cause) {
        super(kind + " [" + fileName + "]: " + message, cause);
        this.kind = kind;
        this.fileName = fileName;
    }

    public Kind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }
}
