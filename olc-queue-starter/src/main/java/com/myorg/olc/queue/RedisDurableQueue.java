package com.myorg.olc.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Redis-backed queue. Every message is a hash {body, attrs, rc, receipt, vis}; one sorted set
 * holds all message ids scored by the instant they become visible, so in-flight messages stay
 * in it with a future score. Message ids are a zero-padded per-queue sequence, which keeps
 * messages visible at the same millisecond in enqueue order.
 * <p>
 * A receipt handle is {@code <messageId>.<random>}; a redelivery replaces the random part.
 * Moves to the dead-letter queue first push the message out of sight, then enqueue the copy,
 * then delete it: a crash in between redelivers rather than loses it.
 */
@Slf4j
public class RedisDurableQueue implements DurableQueue {

    private static final TypeReference<Map<String, String>> ATTRS = new TypeReference<>() {};

    // returns the new message id
    private static final DefaultRedisScript<String> ENQUEUE_SCRIPT = new DefaultRedisScript<>(
            "local id = string.format('%020d', redis.call('INCR', KEYS[1])) " +
                    "redis.call('HSET', ARGV[1] .. id, 'body', ARGV[2], 'attrs', ARGV[3], 'rc', '0', 'receipt', '', 'vis', ARGV[4]) " +
                    "redis.call('ZADD', KEYS[2], tonumber(ARGV[4]), id) " +
                    "return id",
            String.class
    );

    // flat list of (kind, id): R = received with the next receipt, X = receive budget used up
    @SuppressWarnings("rawtypes")
    private static final DefaultRedisScript<List> RECEIVE_SCRIPT = new DefaultRedisScript<>(
            "local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[2], 'LIMIT', 0, tonumber(ARGV[3])) " +
                    "local out = {} " +
                    "local n = 0 " +
                    "local limit = tonumber(ARGV[5]) " +
                    "for _, id in ipairs(ids) do " +
                    "  local mk = ARGV[1] .. id " +
                    "  local rc = redis.call('HGET', mk, 'rc') " +
                    "  if not rc then " +
                    "    redis.call('ZREM', KEYS[1], id) " +
                    "  elseif limit > 0 and tonumber(rc) >= limit then " +
                    "    redis.call('HSET', mk, 'receipt', '', 'vis', ARGV[4]) " +
                    "    redis.call('ZADD', KEYS[1], tonumber(ARGV[4]), id) " +
                    "    table.insert(out, 'X') table.insert(out, id) " +
                    "  else " +
                    "    n = n + 1 " +
                    "    redis.call('HSET', mk, 'rc', tonumber(rc) + 1, 'receipt', id .. '.' .. ARGV[5 + n], 'vis', ARGV[4]) " +
                    "    redis.call('ZADD', KEYS[1], tonumber(ARGV[4]), id) " +
                    "    table.insert(out, 'R') table.insert(out, id) " +
                    "  end " +
                    "end " +
                    "return out",
            List.class
    );

    // 1 = removed, 0 = stale receipt
    private static final DefaultRedisScript<Long> ACK_SCRIPT = new DefaultRedisScript<>(
            "local mk = ARGV[1] .. ARGV[2] " +
                    "if redis.call('HGET', mk, 'receipt') ~= ARGV[3] then return 0 end " +
                    "redis.call('ZREM', KEYS[1], ARGV[2]) " +
                    "redis.call('DEL', mk) " +
                    "return 1",
            Long.class
    );

    // 1 = moved, 0 = stale receipt
    private static final DefaultRedisScript<Long> VISIBILITY_SCRIPT = new DefaultRedisScript<>(
            "local mk = ARGV[1] .. ARGV[2] " +
                    "if redis.call('HGET', mk, 'receipt') ~= ARGV[3] then return 0 end " +
                    "redis.call('HSET', mk, 'vis', ARGV[4]) " +
                    "redis.call('ZADD', KEYS[1], tonumber(ARGV[4]), ARGV[2]) " +
                    "return 1",
            Long.class
    );

    // hides the message and voids its receipt; 1 = claimed, 0 = stale receipt
    private static final DefaultRedisScript<Long> CLAIM_SCRIPT = new DefaultRedisScript<>(
            "local mk = ARGV[1] .. ARGV[2] " +
                    "if redis.call('HGET', mk, 'receipt') ~= ARGV[3] then return 0 end " +
                    "redis.call('HSET', mk, 'receipt', '', 'vis', ARGV[4]) " +
                    "redis.call('ZADD', KEYS[1], tonumber(ARGV[4]), ARGV[2]) " +
                    "return 1",
            Long.class
    );

    private static final DefaultRedisScript<Long> DELETE_SCRIPT = new DefaultRedisScript<>(
            "redis.call('ZREM', KEYS[1], ARGV[2]) " +
                    "return redis.call('DEL', ARGV[1] .. ARGV[2])",
            Long.class
    );

    private final String name;
    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final DeadLetterPolicy policy; // may be null
    private final Function<String, DurableQueue> queueResolver;

    private final String dueKey;
    private final String seqKey;
    private final String messagePrefix;

    public RedisDurableQueue(String name,
                             StringRedisTemplate redis,
                             ObjectMapper mapper,
                             Clock clock,
                             String keyPrefix,
                             Duration visibilityTimeout,
                             DeadLetterPolicy policy,
                             Function<String, DurableQueue> queueResolver) {
        if (visibilityTimeout == null || visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive");
        }
        this.name = name;
        this.redis = redis;
        this.mapper = mapper;
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
        this.policy = policy;
        this.queueResolver = queueResolver;

        // hash tag keeps one queue's keys in one cluster slot
        String base = (keyPrefix == null ? "" : keyPrefix) + "{" + name + "}:";
        this.dueKey = base + "due";
        this.seqKey = base + "seq";
        this.messagePrefix = base + "m:";
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String enqueue(String body, Map<String, String> attributes) {
        String attrs = writeAttributes(attributes == null ? Map.of() : attributes);
        return call(() -> redis.execute(ENQUEUE_SCRIPT, List.of(seqKey, dueKey),
                messagePrefix, body, attrs, String.valueOf(clock.millis())));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<QueueMessage> receiveBatch(int maxMessages) {
        if (maxMessages <= 0) return List.of();

        long now = clock.millis();
        long deadline = now + visibilityTimeout.toMillis();
        int limit = policy == null ? 0 : policy.maxReceiveCount();

        List<String> args = new ArrayList<>(5 + maxMessages);
        args.add(messagePrefix);
        args.add(String.valueOf(now));
        args.add(String.valueOf(maxMessages));
        args.add(String.valueOf(deadline));
        args.add(String.valueOf(limit));
        for (int i = 0; i < maxMessages; i++) args.add(UUID.randomUUID().toString());

        List<String> claimed = call(() -> (List<String>) redis.execute(RECEIVE_SCRIPT, List.of(dueKey), args.toArray()));
        if (claimed == null) return List.of();

        List<QueueMessage> batch = new ArrayList<>();
        for (int i = 0; i + 1 < claimed.size(); i += 2) {
            String id = claimed.get(i + 1);
            Optional<QueueMessage> m = load(id);
            if (m.isEmpty()) continue;
            if ("X".equals(claimed.get(i))) {
                Map<String, String> reason = new HashMap<>();
                reason.put(DeadLetterAttributes.REASON, "MAX_RECEIVE_COUNT");
                reason.put(DeadLetterAttributes.NON_RETRYABLE, "false");
                moveToDeadLetter(m.get(), reason);
            } else {
                batch.add(m.get());
            }
        }
        return batch;
    }

    @Override
    public boolean acknowledge(String receiptHandle) {
        String id = messageIdOf(receiptHandle);
        if (id == null) return false;
        Long res = call(() -> redis.execute(ACK_SCRIPT, List.of(dueKey), messagePrefix, id, receiptHandle));
        return res != null && res == 1L;
    }

    @Override
    public boolean changeVisibility(String receiptHandle, Duration visibleAfter) {
        String id = messageIdOf(receiptHandle);
        if (id == null) return false;
        long at = clock.millis() + (visibleAfter.isNegative() ? 0 : visibleAfter.toMillis());
        Long res = call(() -> redis.execute(VISIBILITY_SCRIPT, List.of(dueKey), messagePrefix, id, receiptHandle,
                String.valueOf(at)));
        return res != null && res == 1L;
    }

    @Override
    public boolean deadLetter(String receiptHandle, Map<String, String> reasonAttributes) {
        if (policy == null) {
            throw new IllegalStateException("Queue " + name + " has no dead-letter policy");
        }
        String id = messageIdOf(receiptHandle);
        if (id == null) return false;
        String hiddenUntil = String.valueOf(clock.millis() + visibilityTimeout.toMillis());
        Long res = call(() -> redis.execute(CLAIM_SCRIPT, List.of(dueKey), messagePrefix, id, receiptHandle, hiddenUntil));
        if (res == null || res != 1L) return false;

        Optional<QueueMessage> m = load(id);
        if (m.isEmpty()) return false;
        moveToDeadLetter(m.get(), reasonAttributes);
        return true;
    }

    @Override
    public List<QueueMessage> peek(int maxMessages) {
        if (maxMessages <= 0) return List.of();
        Set<String> ids = call(() -> redis.opsForZSet().range(dueKey, 0, maxMessages - 1));
        if (ids == null) return List.of();
        List<QueueMessage> out = new ArrayList<>();
        for (String id : ids) {
            load(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public int size() {
        Long n = call(() -> redis.opsForZSet().zCard(dueKey));
        return n == null ? 0 : n.intValue();
    }

    @Override
    public Optional<DeadLetterPolicy> deadLetterPolicy() {
        return Optional.ofNullable(policy);
    }

    private Optional<QueueMessage> load(String id) {
        Map<String, String> h = call(() -> redis.<String, String>opsForHash().entries(messagePrefix + id));
        if (h == null || h.isEmpty()) return Optional.empty();
        String receipt = h.getOrDefault("receipt", "");
        return Optional.of(new QueueMessage(
                id,
                h.get("body"),
                readAttributes(h.get("attrs")),
                Integer.parseInt(h.getOrDefault("rc", "0")),
                Instant.ofEpochMilli(Long.parseLong(h.getOrDefault("vis", "0"))),
                receipt.isEmpty() ? null : receipt));
    }

    private void moveToDeadLetter(QueueMessage m, Map<String, String> reasonAttributes) {
        Map<String, String> attrs = new HashMap<>(m.attributes());
        if (reasonAttributes != null) attrs.putAll(reasonAttributes);
        attrs.put(DeadLetterAttributes.SOURCE_QUEUE, name);
        attrs.put(DeadLetterAttributes.RECEIVE_COUNT, String.valueOf(m.receiveCount()));
        attrs.putIfAbsent(DeadLetterAttributes.TS_MS, String.valueOf(clock.millis()));

        queueResolver.apply(policy.deadLetterQueue()).enqueue(m.body(), attrs);
        call(() -> redis.execute(DELETE_SCRIPT, List.of(dueKey), messagePrefix, m.messageId()));
        log.warn("Message dead-lettered queue={} dlq={} messageId={} receiveCount={} reason={}",
                name, policy.deadLetterQueue(), m.messageId(), m.receiveCount(), attrs.get(DeadLetterAttributes.REASON));
    }

    private static String messageIdOf(String receiptHandle) {
        if (receiptHandle == null) return null;
        int dot = receiptHandle.indexOf('.');
        return dot <= 0 ? null : receiptHandle.substring(0, dot);
    }

    private String writeAttributes(Map<String, String> attributes) {
        try {
            return mapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode attributes for queue " + name, e);
        }
    }

    private Map<String, String> readAttributes(String json) {
        if (json == null || json.isEmpty()) return Map.of();
        try {
            return mapper.readValue(json, ATTRS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt attributes on queue " + name, e);
        }
    }

    private static <T> T call(Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Queue store unavailable: " + e.getMessage(), e);
        }
    }
}
