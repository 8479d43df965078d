package com.myorg.olc.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.store.LedgerKeys;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.store.WriteOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Directory of live connections, kept in the shared ledger store so any instance can push.
 * Each row records the instance holding the socket.
 */
@Slf4j
public class ConnectionRegistry {

    public static final String NAMESPACE = "connection";
    static final String SORT_KEY = "connection";

    private final LedgerStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String instanceId;

    /** Single-instance registry with a random instance id. */
    public ConnectionRegistry(LedgerStore store, ObjectMapper mapper, Clock clock) {
        this(store, mapper, clock, UUID.randomUUID().toString());
    }

    public ConnectionRegistry(LedgerStore store, ObjectMapper mapper, Clock clock, String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId is required");
        }
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.instanceId = instanceId;
    }

    public String instanceId() {
        return instanceId;
    }

    public Connection onConnect(String connectionId) {
        Connection c = new Connection(connectionId, clock.millis(), instanceId);
        ObjectNode payload = mapper.createObjectNode()
                .put("connectionId", c.connectionId())
                .put("establishedAtMs", c.establishedAtMs())
                .put("instanceId", c.instanceId());

        WriteOutcome outcome = store.putIfAbsent(NAMESPACE,
                LedgerEntry.of(partitionKey(connectionId), SORT_KEY, payload));
        if (outcome == WriteOutcome.ALREADY_EXISTS) {
            log.debug("Connection already registered connectionId={}", connectionId);
            return find(connectionId).orElse(c);
        }
        log.info("Connection opened connectionId={} instanceId={}", connectionId, instanceId);
        return c;
    }

    /** Idempotent. */
    public void onDisconnect(String connectionId) {
        store.delete(partitionKey(connectionId), SORT_KEY);
        log.info("Connection closed connectionId={}", connectionId);
    }

    public Optional<Connection> find(String connectionId) {
        return store.get(partitionKey(connectionId), SORT_KEY)
                .map(e -> new Connection(
                        e.payload().path("connectionId").asText(connectionId),
                        e.payload().path("establishedAtMs").asLong(),
                        e.payload().path("instanceId").asText(null)));
    }

    /** True when this instance holds the socket, or the row predates owner tracking. */
    public boolean isLocal(Connection connection) {
        return connection.instanceId() == null || instanceId.equals(connection.instanceId());
    }

    public static String partitionKey(String connectionId) {
        return LedgerKeys.key(NAMESPACE, connectionId);
    }
}
