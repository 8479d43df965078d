package com.myorg.olc.connection.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.connection.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Redis pub/sub relay. Every instance subscribes to its own channel {@code <prefix><instanceId>};
 * a push for a socket held elsewhere is published there and written out by the holder.
 * No subscriber on the channel means the holder is gone.
 */
@Slf4j
public class RedisChannelRelay implements ChannelRelay, MessageListener {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final ChannelGateway gateway;
    private final ConnectionRegistry registry;
    private final String channelPrefix;

    public RedisChannelRelay(StringRedisTemplate redis, ObjectMapper mapper, ChannelGateway gateway,
                             ConnectionRegistry registry, String channelPrefix) {
        this.redis = redis;
        this.mapper = mapper;
        this.gateway = gateway;
        this.registry = registry;
        this.channelPrefix = channelPrefix;
    }

    public String channelFor(String instanceId) {
        return channelPrefix + instanceId;
    }

    /** The channel this instance listens on. */
    public ChannelTopic localTopic() {
        return new ChannelTopic(channelFor(registry.instanceId()));
    }

    @Override
    public boolean relay(String ownerInstanceId, String connectionId, String payload) {
        String envelope;
        try {
            envelope = mapper.writeValueAsString(mapper.createObjectNode()
                    .put("connectionId", connectionId)
                    .put("payload", payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode relay envelope connectionId=" + connectionId, e);
        }
        Long receivers;
        try {
            receivers = redis.convertAndSend(channelFor(ownerInstanceId), envelope);
        } catch (DataAccessException e) {
            throw new ChannelSendException("Relay publish failed connectionId=" + connectionId, e);
        }
        log.debug("Relayed push connectionId={} to instanceId={} receivers={}", connectionId, ownerInstanceId, receivers);
        return receivers != null && receivers > 0;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        JsonNode envelope;
        try {
            envelope = mapper.readTree(new String(message.getBody(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Dropping unreadable relay message channel={}", new String(message.getChannel(), StandardCharsets.UTF_8), e);
            return;
        }
        deliver(envelope.path("connectionId").asText(null), envelope.path("payload").asText(null));
    }

    /** Writes a relayed payload to a socket held here. Runs on the listener thread, so failures end here. */
    void deliver(String connectionId, String payload) {
        if (connectionId == null || payload == null) {
            log.warn("Dropping relay message without connectionId or payload");
            return;
        }
        try {
            gateway.send(connectionId, payload);
        } catch (ChannelGoneException e) {
            log.info("Relayed push found client gone, removing connection connectionId={}", connectionId);
            registry.onDisconnect(connectionId);
        } catch (RuntimeException e) {
            log.warn("Relayed push failed connectionId={} error={}", connectionId, e.toString());
        }
    }
}
