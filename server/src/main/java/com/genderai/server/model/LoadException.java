package com.genderai.server.model;

import java.time.Instant;

/**
 * The model bundle could not be brought to Ready.
 */
public class LoadException extends Exception {

    public enum Kind {
        ARTIFACT_UNAVAILABLE,
        CORRUPT_ARTIFACT,
        TIMEOUT,
        /** The caller stopped waiting; the shared attempt is still running. */
        STILL_LOADING
    }

    private final Kind kind;
    private final Instant retryAfter;

    public LoadException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public LoadException(Kind kind, String message, Instant retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Earliest time a new load attempt will be made, or null when unknown.
     */
    public Instant getRetryAfter() {
        return retryAfter;
    }

    public LoadException withRetryAfter(Instant retryAfter) {
        return new LoadException(kind, getMessage(), retryAfter, getCause());
    }
}
