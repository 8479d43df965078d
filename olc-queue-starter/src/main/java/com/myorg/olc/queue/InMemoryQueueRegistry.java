package com.myorg.olc.queue;

import com.myorg.olc.queue.autoconfig.OlcQueueProperties;

import java.time.Clock;
import java.time.Duration;

public class InMemoryQueueRegistry extends AbstractQueueRegistry {

    public InMemoryQueueRegistry(OlcQueueProperties props, Clock clock) {
        super(props, clock);
        declareConfiguredQueues();
    }

    @Override
    protected DurableQueue newQueue(String name, Duration visibilityTimeout, DeadLetterPolicy policy) {
        return new InMemoryDurableQueue(name, clock(), visibilityTimeout, policy, this::queue);
    }
}
