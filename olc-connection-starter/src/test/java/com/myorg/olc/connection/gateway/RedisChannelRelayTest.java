package com.myorg.olc.connection.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.connection.ConnectionPusher;
import com.myorg.olc.connection.ConnectionRegistry;
import com.myorg.olc.connection.PushResult;
import com.myorg.olc.ledger.store.InMemoryLedgerStore;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class RedisChannelRelayTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.systemUTC();
    private final List<String> deliveredOnA = new CopyOnWriteArrayList<>();
    private final Set<String> goneOnA = ConcurrentHashMap.newKeySet();

    private LettuceConnectionFactory factory;
    private RedisMessageListenerContainer listenerA;
    private ConnectionRegistry registryA;
    private ConnectionRegistry registryB;
    private RedisChannelRelay relayB;
    private ConnectionPusher pusherB;

    @BeforeEach
    void setUp() {
        factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        factory.afterPropertiesSet();
        StringRedisTemplate redis = new StringRedisTemplate(factory);
        String prefix = "it:" + UUID.randomUUID() + ":relay:";

        InMemoryLedgerStore shared = new InMemoryLedgerStore(clock);
        registryA = new ConnectionRegistry(shared, mapper, clock, "instance-a");
        registryB = new ConnectionRegistry(shared, mapper, clock, "instance-b");

        ChannelGateway gatewayA = (connectionId, payload) -> {
            if (goneOnA.contains(connectionId)) throw new ChannelGoneException(connectionId);
            deliveredOnA.add(connectionId + ":" + payload);
        };
        RedisChannelRelay relayA = new RedisChannelRelay(redis, mapper, gatewayA, registryA, prefix);
        relayB = new RedisChannelRelay(redis, mapper, (id, p) -> { }, registryB, prefix);
        pusherB = new ConnectionPusher(registryB, (id, p) -> { }, mapper, null, relayB);

        listenerA = new RedisMessageListenerContainer();
        listenerA.setConnectionFactory(factory);
        listenerA.addMessageListener(relayA, relayA.localTopic());
        listenerA.afterPropertiesSet();
        listenerA.start();

        // subscription is asynchronous
        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> relayB.relay("instance-a", "warm-up", "{}"));
    }

    @AfterEach
    void tearDown() throws Exception {
        listenerA.destroy();
        factory.destroy();
    }

    @Test
    void pushIsWrittenOutByTheHoldingInstance() {
        registryA.onConnect("c1");

        assertThat(pusherB.push("c1", "{\"status\":\"COMPLETED\"}")).isEqualTo(PushResult.DELIVERED);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> deliveredOnA.contains("c1:{\"status\":\"COMPLETED\"}"));
        assertThat(registryB.find("c1")).isPresent();
    }

    @Test
    void holderPrunesAClientThatWentAway() {
        registryA.onConnect("c2");
        goneOnA.add("c2");

        assertThat(pusherB.push("c2", "{}")).isEqualTo(PushResult.DELIVERED);

        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> registryA.find("c2").isEmpty());
    }

    @Test
    void instanceWithoutSubscriberIsUnreachable() {
        assertThat(relayB.relay("instance-stopped", "c3", "{}")).isFalse();
    }
}
