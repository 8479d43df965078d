package com.myorg.olc.contracts.core.exception;

public class OlcRetryableException extends RuntimeException {
    public OlcRetryableException(String msg) { super(msg); }
    public OlcRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
