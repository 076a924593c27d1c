package com.codewarden.core.engine;

/**
 * Thrown when a request is missing required fields or carries malformed values.
 * Raised before any analysis starts.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
