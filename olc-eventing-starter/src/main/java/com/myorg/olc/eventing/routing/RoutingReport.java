package com.myorg.olc.eventing.routing;

import java.util.List;
import java.util.Map;

/**
 * Outcome of fanning out one event.
 *
 * @param matched      subscriptions whose filter matched
 * @param delivered    matched subscriptions that accepted the event
 * @param deadLettered DIRECT subscriptions that gave up; the event sits in their dead-letter queue
 * @param failed       subscriptions whose delivery failed, with the error; nothing was recorded for them
 */
public record RoutingReport(
        List<String> matched,
        List<String> delivered,
        List<String> deadLettered,
        Map<String, String> failed
) {
    public RoutingReport {
        matched = List.copyOf(matched);
        delivered = List.copyOf(delivered);
        deadLettered = List.copyOf(deadLettered);
        failed = Map.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
