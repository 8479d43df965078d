package com.myorg.olc.contracts.core.exception;

// store unreachable or timed out; safe to retry with back-off
public class TransientStoreException extends OlcRetryableException {
    public TransientStoreException(String msg) { super(msg); }
    public TransientStoreException(String msg, Throwable cause) { super(msg, cause); }
}
