package com.genderai.server.ai;

/**
 * Unexpected failure inside a forward pass or its pre/post-processing.
 */
public class InferenceException extends RuntimeException {
    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
