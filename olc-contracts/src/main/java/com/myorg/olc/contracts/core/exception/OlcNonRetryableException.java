package com.myorg.olc.contracts.core.exception;

/**
 * Failure that retrying cannot fix. Queue consumers dead-letter the message right away
 * and Kafka error handlers skip the retry back-off.
 */
public class OlcNonRetryableException extends RuntimeException {

    private final String reason;

    public OlcNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public OlcNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public OlcNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
