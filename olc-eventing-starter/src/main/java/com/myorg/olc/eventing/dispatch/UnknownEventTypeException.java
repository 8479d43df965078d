package com.myorg.olc.eventing.dispatch;

import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;

public class UnknownEventTypeException extends OlcNonRetryableException {
    public UnknownEventTypeException(String eventType, String eventId) {
        super("UNKNOWN_EVENT_TYPE", "Unknown eventType=" + eventType + " eventId=" + eventId);
    }
}
