package com.myorg.olc.example;

import com.myorg.olc.contracts.order.OrderEvent;
import com.myorg.olc.eventing.subscriber.OrderEventSubscriber;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bills created orders. Order ids starting with {@code FAIL_} fail on purpose so the retry and
 * dead-letter path can be watched.
 */
@Slf4j
@Component
public class BillingSubscriber {

    public static final String BILLED = "olc.example.billed";

    private final Counter billed;

    public BillingSubscriber(MeterRegistry registry) {
        this.billed = registry.counter(BILLED);
    }

    @OrderEventSubscriber("billing")
    public void onOrderCreated(OrderEvent event) {
        if (event.getOrderId().startsWith("FAIL_")) {
            throw new IllegalStateException("billing rejected orderId=" + event.getOrderId());
        }
        log.info("Billing orderId={} payload={}", event.getOrderId(), event.getPayload());
        billed.increment();
    }
}
