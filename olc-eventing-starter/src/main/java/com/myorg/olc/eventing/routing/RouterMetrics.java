package com.myorg.olc.eventing.routing;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class RouterMetrics {

    public static final String MATCHED = "olc.router.matched";
    public static final String DELIVERED = "olc.router.delivered";
    public static final String DEAD_LETTERED = "olc.router.dead_lettered";
    public static final String FAILED = "olc.router.failed";

    private final MeterRegistry registry;

    public void preRegister(RoutingTable table) {
        Counter.builder(MATCHED).register(registry);
        Counter.builder(DELIVERED).register(registry);
        Counter.builder(DEAD_LETTERED).register(registry);
        Counter.builder(FAILED).register(registry);
        for (Subscription s : table.subscriptions()) {
            for (String name : new String[]{MATCHED, DELIVERED, DEAD_LETTERED, FAILED}) {
                Counter.builder(name).tag("subscription", s.name()).register(registry);
            }
        }
    }

    void inc(String metric, String subscription) {
        registry.counter(metric, "subscription", subscription).increment();
    }
}
