package com.genderai.server.inference;

/**
 * The inference pool and its queue are full.
 */
public class BusyException extends RuntimeException {
    public BusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
