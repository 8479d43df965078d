package com.myorg.olc.queue;

import com.myorg.olc.queue.autoconfig.OlcQueueProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves queue settings from {@link OlcQueueProperties} and caches one handle per name.
 * Subclasses choose the backing store.
 */
public abstract class AbstractQueueRegistry implements QueueRegistry {

    private final ConcurrentHashMap<String, DurableQueue> queues = new ConcurrentHashMap<>();
    private final OlcQueueProperties props;
    private final Clock clock;

    protected AbstractQueueRegistry(OlcQueueProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    protected abstract DurableQueue newQueue(String name, Duration visibilityTimeout, DeadLetterPolicy policy);

    /** Called by subclasses once constructed; declared queues are visible to operators and gauges from the start. */
    protected final void declareConfiguredQueues() {
        props.getQueues().keySet().forEach(this::queue);
    }

    protected Clock clock() {
        return clock;
    }

    @Override
    public DurableQueue queue(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("queue name is required");
        DurableQueue q = queues.get(name);
        if (q != null) return q;

        DurableQueue created = create(name);
        DurableQueue prev = queues.putIfAbsent(name, created);
        DurableQueue result = prev != null ? prev : created;

        // make sure the dead-letter queue exists too
        result.deadLetterPolicy().ifPresent(p -> queue(p.deadLetterQueue()));
        return result;
    }

    @Override
    public Optional<DurableQueue> find(String name) {
        return Optional.ofNullable(queues.get(name));
    }

    @Override
    public Collection<DurableQueue> all() {
        return List.copyOf(queues.values());
    }

    private DurableQueue create(String name) {
        OlcQueueProperties.QueueSpec spec = props.getQueues().get(name);
        Duration visibility = spec != null && spec.getVisibilityTimeout() != null
                ? spec.getVisibilityTimeout()
                : props.getDefaultVisibilityTimeout();

        DeadLetterPolicy policy = null;
        if (spec != null && spec.getDeadLetterQueue() != null && !spec.getDeadLetterQueue().isBlank()) {
            if (spec.getDeadLetterQueue().equals(name)) {
                throw new IllegalStateException("Queue " + name + " cannot be its own dead-letter queue");
            }
            policy = new DeadLetterPolicy(spec.getMaxReceiveCount(), spec.getDeadLetterQueue());
        }
        return newQueue(name, visibility, policy);
    }
}
