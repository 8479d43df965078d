package com.myorg.olc.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * At-least-once queue. A received message stays invisible until its visibility deadline and
 * reappears unless acknowledged before then.
 */
public interface DurableQueue {

    String name();

    /** @return message id */
    String enqueue(String body, Map<String, String> attributes);

    /**
     * Receives up to {@code maxMessages} visible messages, incrementing each receive count.
     * Messages that already used up their receive budget are moved to the dead-letter queue instead.
     */
    List<QueueMessage> receiveBatch(int maxMessages);

    /** @return false when the receipt is stale (message redelivered or already gone) */
    boolean acknowledge(String receiptHandle);

    boolean changeVisibility(String receiptHandle, Duration visibleAfter);

    /**
     * Copies the message verbatim to the dead-letter queue, with {@code reasonAttributes} added,
     * and removes it from this queue.
     */
    boolean deadLetter(String receiptHandle, Map<String, String> reasonAttributes);

    /** Operator inspection. Does not change visibility or receive counts. */
    List<QueueMessage> peek(int maxMessages);

    int size();

    Optional<DeadLetterPolicy> deadLetterPolicy();
}
