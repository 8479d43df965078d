package com.myorg.olc.contracts.core.exception;

public class PoisonMessageException extends OlcNonRetryableException {
    public PoisonMessageException(String message) {
        super("POISON_MESSAGE", message);
    }

    public PoisonMessageException(String message, Throwable cause) {
        super("POISON_MESSAGE", message, cause);
    }
}
