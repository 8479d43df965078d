package com.myorg.olc.queue.consumer;

import com.myorg.olc.queue.DurableQueue;
import com.myorg.olc.queue.QueueRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class QueueMetrics {

    private final MeterRegistry registry;
    private final QueueRegistry queues;

    public void preRegister() {
        Counter.builder("olc.queue.acknowledged").register(registry);
        Counter.builder("olc.queue.retried").register(registry);
        Counter.builder("olc.queue.dead_lettered").register(registry);
        Counter.builder("olc.queue.timeout").register(registry);

        for (DurableQueue q : queues.all()) {
            Gauge.builder("olc.queue.depth", q, DurableQueue::size).tag("queue", q.name()).register(registry);
        }
    }

    public void incAcknowledged(String queue) { inc("olc.queue.acknowledged", queue); }
    public void incRetried(String queue) { inc("olc.queue.retried", queue); }
    public void incDeadLettered(String queue) { inc("olc.queue.dead_lettered", queue); }
    public void incTimeout(String queue) { inc("olc.queue.timeout", queue); }

    private void inc(String name, String queue) {
        registry.counter(name, "queue", queue).increment();
    }
}
