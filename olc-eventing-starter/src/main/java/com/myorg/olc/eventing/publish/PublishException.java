package com.myorg.olc.eventing.publish;

/**
 * An order event could not be handed to the topic: transport unreachable, envelope too large,
 * or not serializable.
 */
public class PublishException extends RuntimeException {
    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
