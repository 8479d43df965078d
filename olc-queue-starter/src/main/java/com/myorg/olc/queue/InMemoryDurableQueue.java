package com.myorg.olc.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

@Slf4j
public class InMemoryDurableQueue implements DurableQueue {

    private static final class Slot {
        final String messageId;
        final String body;
        final Map<String, String> attributes;
        int receiveCount;
        Instant visibleAt;
        String receiptHandle;

        Slot(String messageId, String body, Map<String, String> attributes, Instant visibleAt) {
            this.messageId = messageId;
            this.body = body;
            this.attributes = attributes;
            this.visibleAt = visibleAt;
        }

        QueueMessage snapshot() {
            return new QueueMessage(messageId, body, attributes, receiveCount, visibleAt, receiptHandle);
        }
    }

    private final String name;
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final DeadLetterPolicy policy; // may be null
    private final Function<String, DurableQueue> queueResolver;

    // insertion order = FIFO among visible messages
    private final LinkedHashMap<String, Slot> slots = new LinkedHashMap<>();

    public InMemoryDurableQueue(String name,
                                Clock clock,
                                Duration visibilityTimeout,
                                DeadLetterPolicy policy,
                                Function<String, DurableQueue> queueResolver) {
        if (visibilityTimeout == null || visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive");
        }
        this.name = name;
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
        this.policy = policy;
        this.queueResolver = queueResolver;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized String enqueue(String body, Map<String, String> attributes) {
        String id = UUID.randomUUID().toString();
        Map<String, String> attrs = attributes == null ? Map.of() : Map.copyOf(attributes);
        slots.put(id, new Slot(id, body, attrs, clock.instant()));
        return id;
    }

    @Override
    public List<QueueMessage> receiveBatch(int maxMessages) {
        if (maxMessages <= 0) return List.of();

        List<QueueMessage> batch = new ArrayList<>();
        List<Slot> exhausted = new ArrayList<>();

        synchronized (this) {
            Instant now = clock.instant();
            Iterator<Slot> it = slots.values().iterator();
            while (it.hasNext() && batch.size() < maxMessages) {
                Slot s = it.next();
                if (s.visibleAt.isAfter(now)) continue;

                if (policy != null && s.receiveCount >= policy.maxReceiveCount()) {
                    it.remove();
                    exhausted.add(s);
                    continue;
                }
                s.receiveCount++;
                s.receiptHandle = UUID.randomUUID().toString();
                s.visibleAt = now.plus(visibilityTimeout);
                batch.add(s.snapshot());
            }
        }

        // outside our monitor: the dead-letter queue takes its own
        for (Slot s : exhausted) {
            Map<String, String> reason = new HashMap<>();
            reason.put(DeadLetterAttributes.REASON, "MAX_RECEIVE_COUNT");
            reason.put(DeadLetterAttributes.NON_RETRYABLE, "false");
            moveToDeadLetter(s, reason);
        }
        return batch;
    }

    @Override
    public synchronized boolean acknowledge(String receiptHandle) {
        Slot s = byReceipt(receiptHandle);
        if (s == null) return false;
        slots.remove(s.messageId);
        return true;
    }

    @Override
    public synchronized boolean changeVisibility(String receiptHandle, Duration visibleAfter) {
        Slot s = byReceipt(receiptHandle);
        if (s == null) return false;
        s.visibleAt = clock.instant().plus(visibleAfter.isNegative() ? Duration.ZERO : visibleAfter);
        return true;
    }

    @Override
    public boolean deadLetter(String receiptHandle, Map<String, String> reasonAttributes) {
        if (policy == null) {
            throw new IllegalStateException("Queue " + name + " has no dead-letter policy");
        }
        Slot s;
        synchronized (this) {
            s = byReceipt(receiptHandle);
            if (s == null) return false;
            slots.remove(s.messageId);
        }
        moveToDeadLetter(s, reasonAttributes);
        return true;
    }

    @Override
    public synchronized List<QueueMessage> peek(int maxMessages) {
        List<QueueMessage> out = new ArrayList<>();
        for (Slot s : slots.values()) {
            if (out.size() >= maxMessages) break;
            out.add(s.snapshot());
        }
        return out;
    }

    @Override
    public synchronized int size() {
        return slots.size();
    }

    @Override
    public Optional<DeadLetterPolicy> deadLetterPolicy() {
        return Optional.ofNullable(policy);
    }

    private Slot byReceipt(String receiptHandle) {
        if (receiptHandle == null) return null;
        for (Slot s : slots.values()) {
            if (receiptHandle.equals(s.receiptHandle)) return s;
        }
        return null;
    }

    private void moveToDeadLetter(Slot s, Map<String, String> reasonAttributes) {
        Map<String, String> attrs = new HashMap<>(s.attributes);
        if (reasonAttributes != null) attrs.putAll(reasonAttributes);
        attrs.put(DeadLetterAttributes.SOURCE_QUEUE, name);
        attrs.put(DeadLetterAttributes.RECEIVE_COUNT, String.valueOf(s.receiveCount));
        attrs.putIfAbsent(DeadLetterAttributes.TS_MS, String.valueOf(clock.millis()));

        queueResolver.apply(policy.deadLetterQueue()).enqueue(s.body, attrs);
        log.warn("Message dead-lettered queue={} dlq={} messageId={} receiveCount={} reason={}",
                name, policy.deadLetterQueue(), s.messageId, s.receiveCount, attrs.get(DeadLetterAttributes.REASON));
    }
}
