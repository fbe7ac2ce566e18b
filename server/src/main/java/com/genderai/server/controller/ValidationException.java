package com.genderai.server.controller;

/**
 * Upload rejected at the boundary before reaching the orchestrator.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
