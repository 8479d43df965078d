package com.myorg.olc.queue.consumer;

import com.myorg.olc.contracts.core.exception.OlcRetryableException;

// handler exceeded its wall-clock budget; counts as a failed attempt
public class InvocationTimeoutException extends OlcRetryableException {
    public InvocationTimeoutException(String msg) {
        super(msg);
    }
}
