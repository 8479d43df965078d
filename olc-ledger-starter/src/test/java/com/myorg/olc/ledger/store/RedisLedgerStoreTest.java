package com.myorg.olc.ledger.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class RedisLedgerStoreTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory factory;
    private static StringRedisTemplate redis;

    private final ObjectMapper mapper = new ObjectMapper();
    private RedisLedgerStore store;

    @BeforeAll
    static void connect() {
        factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        factory.afterPropertiesSet();
        redis = new StringRedisTemplate(factory);
    }

    @AfterAll
    static void disconnect() {
        factory.destroy();
    }

    @BeforeEach
    void setUp() {
        // fresh prefix per test keeps tests independent without FLUSHALL
        store = new RedisLedgerStore(redis, mapper, Clock.fixed(Instant.ofEpochSecond(1_000), ZoneOffset.UTC),
                "it:" + UUID.randomUUID());
    }

    @Test
    void writeOnceAndGet() {
        LedgerEntry e = new LedgerEntry("order#o1", "ORDER_CREATED#1", "a@x.io", mapper.createObjectNode().put("n", 1), null);

        assertThat(store.putIfAbsent("order", e)).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(store.putIfAbsent("order", e)).isEqualTo(WriteOutcome.ALREADY_EXISTS);
        assertThat(store.get("order#o1", "ORDER_CREATED#1")).contains(e);
    }

    @Test
    void keysContainingColonsStayDistinct() {
        LedgerEntry left = new LedgerEntry("order#a::b", "c", null, mapper.createObjectNode().put("side", "left"), null);
        LedgerEntry right = new LedgerEntry("order#a", "b::c", null, mapper.createObjectNode().put("side", "right"), null);

        assertThat(store.putIfAbsent("order", left)).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(store.putIfAbsent("order", right)).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(store.get("order#a::b", "c")).contains(left);
        assertThat(store.get("order#a", "b::c")).contains(right);
    }

    @Test
    void expiredEntriesAreAbsentAndPurged() {
        store.put(new LedgerEntry("transaction#t1", "state", null, mapper.createObjectNode(), 900L));

        assertThat(store.get("transaction#t1", "state")).isEmpty();
        assertThat(store.purgeExpired(Instant.ofEpochSecond(1_000)))
                .extracting(LedgerEntry::partitionKey).containsExactly("transaction#t1");
        assertThat(store.purgeExpired(Instant.ofEpochSecond(1_000))).isEmpty();
    }

    @Test
    void conditionalUpdateAndIndexQuery() {
        store.put(new LedgerEntry("order#o2", "ORDER_CREATED#2", "a@x.io", mapper.createObjectNode(), null));
        store.put(new LedgerEntry("order#o1", "ORDER_CREATED#1", "a@x.io", mapper.createObjectNode(), null));

        UpdateResult res = store.update("order", "order#o1", "ORDER_CREATED#1",
                e -> true, e -> e.withPayload(mapper.createObjectNode().put("seen", true)));
        assertThat(res.isApplied()).isTrue();

        LedgerPage page = store.queryByIndex("a@x.io", "ORDER_CREATED#", null, 1);
        assertThat(page.items()).extracting(LedgerEntry::partitionKey).containsExactly("order#o1");
        assertThat(page.items().get(0).payload().get("seen").asBoolean()).isTrue();

        LedgerPage next = store.queryByIndex("a@x.io", "ORDER_CREATED#", page.lastEvaluatedKey(), 1);
        assertThat(next.items()).extracting(LedgerEntry::partitionKey).containsExactly("order#o2");
        assertThat(next.hasMore()).isFalse();

        store.delete("order#o1", "ORDER_CREATED#1");
        assertThat(store.queryByIndex("a@x.io", null, null, 10).items()).hasSize(1);
    }
}
