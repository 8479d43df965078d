package com.myorg.olc.contracts.core.exception;

/**
 * Malformed input. Raised before anything is written.
 */
public class ValidationException extends OlcNonRetryableException {
    public ValidationException(String message) {
        super("VALIDATION", message);
    }

    public ValidationException(String message, Throwable cause) {
        super("VALIDATION", message, cause);
    }
}
