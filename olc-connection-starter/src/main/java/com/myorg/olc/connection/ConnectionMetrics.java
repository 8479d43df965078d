package com.myorg.olc.connection;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ConnectionMetrics {

    public static final String DELIVERED = "olc.push.delivered";
    public static final String GONE = "olc.push.gone";
    public static final String FAILED = "olc.push.failed";

    private final MeterRegistry registry;

    public void preRegister() {
        Counter.builder(DELIVERED).register(registry);
        Counter.builder(GONE).register(registry);
        Counter.builder(FAILED).register(registry);
    }

    void delivered() { registry.counter(DELIVERED).increment(); }
    void gone() { registry.counter(GONE).increment(); }
    void failed() { registry.counter(FAILED).increment(); }
}
