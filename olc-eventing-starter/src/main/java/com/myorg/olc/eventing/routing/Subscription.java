package com.myorg.olc.eventing.routing;

import java.time.Duration;
import java.util.Objects;

/**
 * One entry of the routing table.
 *
 * @param queue target queue for {@link SubscriptionTarget#QUEUE}, ignored otherwise
 * @param retry inline retry for {@link SubscriptionTarget#DIRECT}, ignored otherwise
 */
public record Subscription(
        String name,
        FilterExpression filter,
        SubscriptionTarget target,
        String queue,
        Retry retry
) {
    public static final String DEAD_LETTER_SUFFIX = ".DLQ";

    public Subscription {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        if (filter == null) filter = FilterExpression.matchAll();
        if (retry == null) retry = Retry.DEFAULT;
    }

    /** Queue that receives events a DIRECT subscriber could not handle. */
    public String deadLetterQueue() {
        return name + DEAD_LETTER_SUFFIX;
    }

    public record Retry(int maxAttempts, Duration backoff) {
        public static final Retry DEFAULT = new Retry(3, Duration.ofMillis(200));

        public Retry {
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
            if (backoff == null || backoff.isNegative()) backoff = Duration.ZERO;
        }
    }
}
