package com.myorg.olc.connection.gateway;

import com.myorg.olc.contracts.core.exception.OlcRetryableException;

public class ChannelSendException extends OlcRetryableException {
    public ChannelSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
