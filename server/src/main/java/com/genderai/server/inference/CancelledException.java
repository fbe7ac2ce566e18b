package com.genderai.server.inference;

/**
 * Work stopped at a checkpoint because its caller went away.
 */
public class CancelledException extends RuntimeException {
    public CancelledException(String message) {
        super(message);
    }
}
