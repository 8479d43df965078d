package com.myorg.olc.connection.gateway;

/**
 * Delivers a text frame to one connected client.
 */
public interface ChannelGateway {

    /**
     * @throws ChannelGoneException if the client disconnected
     * @throws ChannelSendException on any other transport failure
     */
    void send(String connectionId, String payload);
}
