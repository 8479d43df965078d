package com.myorg.olc.connection.gateway;

/**
 * Hands a payload to the instance that holds a connection's socket.
 */
@FunctionalInterface
public interface ChannelRelay {

    /**
     * @return false when no live instance answers for {@code ownerInstanceId}
     */
    boolean relay(String ownerInstanceId, String connectionId, String payload);
}
