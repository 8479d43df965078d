package com.myorg.olc.queue;

import java.time.Instant;
import java.util.Map;

/**
 * A delivered copy of a queued message. {@code receiptHandle} identifies this particular
 * delivery: acknowledging with a handle from an earlier delivery has no effect.
 */
public record QueueMessage(
        String messageId,
        String body,
        Map<String, String> attributes,
        int receiveCount,
        Instant visibilityDeadline,
        String receiptHandle
) {
    public QueueMessage {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
