package com.myorg.olc.connection;

/**
 * A live duplex channel to one client. Other components refer to it by id only.
 * {@code instanceId} names the instance holding the socket; null on rows written before it was recorded.
 */
public record Connection(String connectionId, long establishedAtMs, String instanceId) {
}
