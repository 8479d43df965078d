package com.myorg.olc.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.queue.autoconfig.OlcQueueProperties;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/** Queues kept in Redis, shared by every instance pointing at the same server and key prefix. */
public class RedisQueueRegistry extends AbstractQueueRegistry {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final String keyPrefix;

    public RedisQueueRegistry(OlcQueueProperties props, Clock clock, StringRedisTemplate redis, ObjectMapper mapper) {
        super(props, clock);
        this.redis = redis;
        this.mapper = mapper;
        this.keyPrefix = props.getKeyPrefix();
        declareConfiguredQueues();
    }

    @Override
    protected DurableQueue newQueue(String name, Duration visibilityTimeout, DeadLetterPolicy policy) {
        return new RedisDurableQueue(name, redis, mapper, clock(), keyPrefix, visibilityTimeout, policy, this::queue);
    }
}
