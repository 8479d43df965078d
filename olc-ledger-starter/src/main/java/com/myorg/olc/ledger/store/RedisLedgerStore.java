package com.myorg.olc.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.TransientStoreException;
import com.myorg.olc.contracts.core.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Redis-backed store. Each entry is a hash {json, ttl, idx, mem}; the secondary index is a
 * sorted set scanned with ZRANGEBYLEX and a second sorted set scored by ttl drives expiry.
 */
@Slf4j
public class RedisLedgerStore implements LedgerStore {

    private static final int MAX_CAS_ATTEMPTS = 16;

    // 1 = written, 0 = a live entry already exists
    private static final DefaultRedisScript<Long> PUT_SCRIPT = new DefaultRedisScript<>(
            "local t = redis.call('HGET', KEYS[1], 'ttl') " +
                    "if t then " +
                    "  if ARGV[6] ~= '1' and (t == '' or tonumber(t) > tonumber(ARGV[4])) then return 0 end " +
                    "  local oi = redis.call('HGET', KEYS[1], 'idx') " +
                    "  if oi and oi ~= '' then redis.call('ZREM', oi, redis.call('HGET', KEYS[1], 'mem')) end " +
                    "  redis.call('ZREM', KEYS[2], KEYS[1]) " +
                    "  redis.call('DEL', KEYS[1]) " +
                    "end " +
                    "redis.call('HSET', KEYS[1], 'json', ARGV[1], 'ttl', ARGV[2], 'idx', ARGV[5], 'mem', ARGV[3]) " +
                    "if ARGV[5] ~= '' then redis.call('ZADD', ARGV[5], 0, ARGV[3]) end " +
                    "if ARGV[2] ~= '' then redis.call('ZADD', KEYS[2], tonumber(ARGV[2]), KEYS[1]) end " +
                    "return 1",
            Long.class
    );

    private static final DefaultRedisScript<Long> DELETE_SCRIPT = new DefaultRedisScript<>(
            "local oi = redis.call('HGET', KEYS[1], 'idx') " +
                    "if oi and oi ~= '' then redis.call('ZREM', oi, redis.call('HGET', KEYS[1], 'mem')) end " +
                    "redis.call('ZREM', KEYS[2], KEYS[1]) " +
                    "return redis.call('DEL', KEYS[1])",
            Long.class
    );

    // returns the removed json, or false when the entry was renewed meanwhile
    private static final DefaultRedisScript<String> PURGE_SCRIPT = new DefaultRedisScript<>(
            "local t = redis.call('HGET', KEYS[1], 'ttl') " +
                    "if not t then redis.call('ZREM', KEYS[2], KEYS[1]) return false end " +
                    "if t == '' or tonumber(t) > tonumber(ARGV[1]) then return false end " +
                    "local j = redis.call('HGET', KEYS[1], 'json') " +
                    "local oi = redis.call('HGET', KEYS[1], 'idx') " +
                    "if oi and oi ~= '' then redis.call('ZREM', oi, redis.call('HGET', KEYS[1], 'mem')) end " +
                    "redis.call('ZREM', KEYS[2], KEYS[1]) " +
                    "redis.call('DEL', KEYS[1]) " +
                    "return j",
            String.class
    );

    @SuppressWarnings("rawtypes")
    private static final DefaultRedisScript<List> RANGE_SCRIPT = new DefaultRedisScript<>(
            "return redis.call('ZRANGEBYLEX', KEYS[1], ARGV[1], '+', 'LIMIT', 0, tonumber(ARGV[2]))",
            List.class
    );

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisLedgerStore(StringRedisTemplate redis, ObjectMapper mapper, Clock clock, String keyPrefix) {
        this.redis = redis;
        this.mapper = mapper;
        this.clock = clock;
        this.keyPrefix = normalizePrefix(keyPrefix);
    }

    @Override
    public WriteOutcome putIfAbsent(String namespace, LedgerEntry entry) {
        LedgerKeys.requireInNamespace(namespace, entry.partitionKey());
        Long res = call(() -> redis.execute(PUT_SCRIPT, List.of(entryKey(entry), expiryKey()), putArgs(entry, false)));
        return res != null && res == 1L ? WriteOutcome.WRITTEN : WriteOutcome.ALREADY_EXISTS;
    }

    @Override
    public void put(LedgerEntry entry) {
        call(() -> redis.execute(PUT_SCRIPT, List.of(entryKey(entry), expiryKey()), putArgs(entry, true)));
    }

    @Override
    public Optional<LedgerEntry> get(String partitionKey, String sortKey) {
        return call(() -> read(entryKey(partitionKey, sortKey)));
    }

    @Override
    public UpdateResult update(String namespace,
                               String partitionKey,
                               String sortKey,
                               Predicate<LedgerEntry> condition,
                               UnaryOperator<LedgerEntry> mutation) {
        LedgerKeys.requireInNamespace(namespace, partitionKey);
        String key = entryKey(partitionKey, sortKey);

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            UpdateResult[] out = new UpdateResult[1];
            List<Object> exec = call(() -> redis.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);

                    Optional<LedgerEntry> cur = decode(ops.<String, String>opsForHash().entries(key));
                    if (cur.isEmpty()) {
                        ops.unwatch();
                        out[0] = UpdateResult.notFound();
                        return null;
                    }
                    if (!condition.test(cur.get())) {
                        ops.unwatch();
                        out[0] = UpdateResult.conditionFailed(cur.get());
                        return null;
                    }
                    LedgerEntry next = mutation.apply(cur.get());
                    if (!next.partitionKey().equals(partitionKey) || !next.sortKey().equals(sortKey)) {
                        ops.unwatch();
                        throw new ValidationException("update must not change the primary key");
                    }

                    ops.multi();
                    LedgerEntry old = cur.get();
                    if (old.indexKey() != null) {
                        ops.opsForZSet().remove(indexKey(old.indexKey()), LedgerKeys.indexMember(old));
                    }
                    ops.opsForHash().putAll(key, fields(next));
                    if (next.indexKey() != null) {
                        ops.opsForZSet().add(indexKey(next.indexKey()), LedgerKeys.indexMember(next), 0);
                    }
                    if (next.ttl() != null) {
                        ops.opsForZSet().add(expiryKey(), key, next.ttl());
                    } else {
                        ops.opsForZSet().remove(expiryKey(), key);
                    }
                    out[0] = UpdateResult.applied(next);
                    return ops.exec();
                }
            }));

            if (out[0] != null && !out[0].isApplied()) return out[0];
            if (exec != null && !exec.isEmpty()) return out[0];
            log.debug("Optimistic update lost a race key={} attempt={}", key, attempt);
        }
        throw new TransientStoreException("Too much contention updating " + key);
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        call(() -> redis.execute(DELETE_SCRIPT, List.of(entryKey(partitionKey, sortKey), expiryKey())));
    }

    @Override
    @SuppressWarnings("unchecked")
    public LedgerPage queryByIndex(String indexKey, String sortKeyPrefix, String exclusiveStartKey, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        String prefix = sortKeyPrefix == null ? "" : sortKeyPrefix;
        String zkey = indexKey(indexKey);
        Instant now = clock.instant();

        String min = exclusiveStartKey != null ? "(" + exclusiveStartKey
                : prefix.isEmpty() ? "-" : "[" + prefix;
        int chunk = Math.max(limit + 1, 16);

        List<LedgerEntry> items = new ArrayList<>();
        String last = null;
        while (true) {
            String from = min;
            List<String> members = call(() -> (List<String>) redis.execute(RANGE_SCRIPT, List.of(zkey), from, String.valueOf(chunk)));
            if (members == null || members.isEmpty()) return new LedgerPage(items, null);

            for (String member : members) {
                String[] parts = LedgerKeys.splitIndexMember(member);
                if (!parts[0].startsWith(prefix)) return new LedgerPage(items, null);

                Optional<LedgerEntry> e = call(() -> read(entryKey(parts[1], parts[0])));
                if (e.isEmpty() || e.get().isExpiredAt(now) || !indexKey.equals(e.get().indexKey())) continue;

                if (items.size() == limit) return new LedgerPage(items, last);
                items.add(e.get());
                last = member;
            }
            if (members.size() < chunk) return new LedgerPage(items, null);
            min = "(" + members.get(members.size() - 1);
        }
    }

    @Override
    public List<LedgerEntry> purgeExpired(Instant now) {
        long nowSec = now.getEpochSecond();
        Set<String> due = call(() -> redis.opsForZSet().rangeByScore(expiryKey(), Double.NEGATIVE_INFINITY, nowSec));
        List<LedgerEntry> purged = new ArrayList<>();
        if (due == null) return purged;

        for (String key : due) {
            String json = call(() -> redis.execute(PURGE_SCRIPT, List.of(key, expiryKey()), String.valueOf(nowSec)));
            if (json != null) purged.add(fromJson(json));
        }
        return purged;
    }

    private Optional<LedgerEntry> read(String key) {
        return decode(redis.opsForHash().entries(key));
    }

    private Optional<LedgerEntry> decode(Map<?, ?> hash) {
        if (hash == null || hash.isEmpty()) return Optional.empty();
        Object json = hash.get("json");
        if (json == null) return Optional.empty();
        LedgerEntry e = fromJson(json.toString());
        return e.isExpiredAt(clock.instant()) ? Optional.empty() : Optional.of(e);
    }

    private Object[] putArgs(LedgerEntry e, boolean force) {
        return new Object[]{
                toJson(e),
                e.ttl() == null ? "" : String.valueOf(e.ttl()),
                e.indexKey() == null ? "" : LedgerKeys.indexMember(e),
                String.valueOf(clock.instant().getEpochSecond()),
                e.indexKey() == null ? "" : indexKey(e.indexKey()),
                force ? "1" : "0"
        };
    }

    private Map<String, String> fields(LedgerEntry e) {
        return Map.of(
                "json", toJson(e),
                "ttl", e.ttl() == null ? "" : String.valueOf(e.ttl()),
                "idx", e.indexKey() == null ? "" : indexKey(e.indexKey()),
                "mem", e.indexKey() == null ? "" : LedgerKeys.indexMember(e)
        );
    }

    private String toJson(LedgerEntry e) {
        try {
            return mapper.writeValueAsString(e);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Cannot serialize ledger entry " + e.partitionKey() + "/" + e.sortKey());
        }
    }

    private LedgerEntry fromJson(String json) {
        try {
            return mapper.readValue(json, LedgerEntry.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt ledger entry: " + ex.getOriginalMessage(), ex);
        }
    }

    private String entryKey(LedgerEntry e) {
        return entryKey(e.partitionKey(), e.sortKey());
    }

    private String entryKey(String pk, String sk) {
        return keyPrefix + "e:" + LedgerKeys.entryKey(pk, sk);
    }

    private String indexKey(String indexKey) {
        return keyPrefix + "i:" + indexKey;
    }

    private String expiryKey() {
        return keyPrefix + "x";
    }

    private static <T> T call(Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Ledger store unavailable: " + e.getMessage(), e);
        }
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
