package com.myorg.olc.connection.route;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handles inbound client messages whose {@code action} field equals {@link #action()}.
 */
public interface ChannelRouteHandler {

    String action();

    void handle(String connectionId, JsonNode message) throws Exception;
}
