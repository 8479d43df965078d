package com.myorg.olc.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.connection.gateway.ChannelGateway;
import com.myorg.olc.connection.gateway.ChannelGoneException;
import com.myorg.olc.connection.gateway.ChannelRelay;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pushes payloads to connected clients and prunes directory rows for clients that went away.
 * A connection held by another instance is relayed to it; only the holder decides the client is gone.
 */
@Slf4j
public class ConnectionPusher {

    private final ConnectionRegistry registry;
    private final ChannelGateway gateway;
    private final ObjectMapper mapper;
    private final ConnectionMetrics metrics; // may be null
    private final ChannelRelay relay; // may be null

    public ConnectionPusher(ConnectionRegistry registry, ChannelGateway gateway,
                            ObjectMapper mapper, ConnectionMetrics metrics) {
        this(registry, gateway, mapper, metrics, null);
    }

    public ConnectionPusher(ConnectionRegistry registry, ChannelGateway gateway,
                            ObjectMapper mapper, ConnectionMetrics metrics, ChannelRelay relay) {
        this.registry = registry;
        this.gateway = gateway;
        this.mapper = mapper;
        this.metrics = metrics;
        this.relay = relay;
    }

    /**
     * Sends {@code payload} unchanged. Transport failures other than a gone client propagate.
     */
    public PushResult push(String connectionId, String payload) {
        Optional<Connection> row = registry.find(connectionId);
        if (row.isEmpty()) {
            log.debug("Push skipped, no connection row connectionId={}", connectionId);
            if (metrics != null) metrics.gone();
            return PushResult.GONE;
        }
        if (!registry.isLocal(row.get())) {
            return pushRemote(row.get(), payload);
        }
        try {
            gateway.send(connectionId, payload);
        } catch (ChannelGoneException e) {
            log.info("Client gone, removing connection connectionId={}", connectionId);
            registry.onDisconnect(connectionId);
            if (metrics != null) metrics.gone();
            return PushResult.GONE;
        } catch (RuntimeException e) {
            if (metrics != null) metrics.failed();
            throw e;
        }
        if (metrics != null) metrics.delivered();
        return PushResult.DELIVERED;
    }

    private PushResult pushRemote(Connection connection, String payload) {
        String owner = connection.instanceId();
        if (relay == null) {
            // the row belongs to a live peer as far as we know; leave it alone
            log.warn("No relay configured, cannot reach connectionId={} held by instanceId={}",
                    connection.connectionId(), owner);
            if (metrics != null) metrics.gone();
            return PushResult.GONE;
        }
        boolean accepted;
        try {
            accepted = relay.relay(owner, connection.connectionId(), payload);
        } catch (RuntimeException e) {
            if (metrics != null) metrics.failed();
            throw e;
        }
        if (!accepted) {
            log.info("Owner instance unreachable, removing connection connectionId={} instanceId={}",
                    connection.connectionId(), owner);
            registry.onDisconnect(connection.connectionId());
            if (metrics != null) metrics.gone();
            return PushResult.GONE;
        }
        if (metrics != null) metrics.delivered();
        return PushResult.DELIVERED;
    }

    public PushResult pushJson(String connectionId, Object message) {
        try {
            return push(connectionId, mapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize push message for connectionId=" + connectionId, e);
        }
    }

    /**
     * Each push is independent: one failing client does not stop the others.
     * A client whose push threw is absent from the result.
     */
    public Map<String, PushResult> pushAll(Collection<String> connectionIds, String payload) {
        Map<String, PushResult> out = new LinkedHashMap<>();
        for (String id : connectionIds) {
            try {
                out.put(id, push(id, payload));
            } catch (RuntimeException e) {
                log.warn("Push failed connectionId={} error={}", id, e.toString());
            }
        }
        return out;
    }
}
