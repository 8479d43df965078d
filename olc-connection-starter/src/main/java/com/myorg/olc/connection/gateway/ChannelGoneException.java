package com.myorg.olc.connection.gateway;

/**
 * The client behind a connection id can no longer be reached.
 */
public class ChannelGoneException extends RuntimeException {
    public ChannelGoneException(String connectionId) {
        super("Channel gone connectionId=" + connectionId);
    }
}
