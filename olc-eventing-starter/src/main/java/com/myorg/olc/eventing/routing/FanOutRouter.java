package com.myorg.olc.eventing.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.core.exception.ValidationException;
import com.myorg.olc.contracts.order.OrderEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates every subscription of the routing table against an event and delivers a copy to each match.
 * Deliveries are independent: one target failing never prevents the others from receiving the event.
 */
@Slf4j
public class FanOutRouter {

    private final RoutingTable table;
    private final Map<SubscriptionTarget, DeliveryTarget> targets;
    private final ObjectMapper mapper;
    private final String producerName;
    private final RouterMetrics metrics; // may be null

    public FanOutRouter(RoutingTable table,
                        List<DeliveryTarget> deliveryTargets,
                        ObjectMapper mapper,
                        String producerName,
                        RouterMetrics metrics) {
        this.table = table;
        this.mapper = mapper;
        this.producerName = producerName;
        this.metrics = metrics;

        Map<SubscriptionTarget, DeliveryTarget> m = new EnumMap<>(SubscriptionTarget.class);
        deliveryTargets.forEach(t -> m.put(t.kind(), t));
        for (Subscription s : table.subscriptions()) {
            if (!m.containsKey(s.target())) {
                throw new IllegalStateException("No delivery target available for " + s.target()
                        + " (subscription '" + s.name() + "')");
            }
        }
        this.targets = m;
    }

    /** Routes an event that did not come off the topic. */
    public RoutingReport route(OrderEvent event) {
        event.validate();
        EventEnvelope env = EnvelopeBuilder.wrap(mapper, event.getEventType().name(), 1,
                event.getOrderId(), event.getOrderId(), null, producerName, event.attributes(), event);
        return route(new RoutedEvent(event, env));
    }

    /**
     * @throws ValidationException if the envelope does not carry a valid order event
     */
    public RoutingReport route(EventEnvelope env) {
        OrderEvent event;
        try {
            event = mapper.treeToValue(env.getPayload(), OrderEvent.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Envelope eventId=" + env.getEventId() + " does not carry an order event", e);
        }
        if (event == null) {
            throw new ValidationException("Envelope eventId=" + env.getEventId() + " has no payload");
        }
        return route(new RoutedEvent(event.validate(), env));
    }

    public RoutingReport route(RoutedEvent routed) {
        Map<String, String> attributes = routed.event().attributes();

        List<String> matched = new ArrayList<>();
        List<String> delivered = new ArrayList<>();
        List<String> deadLettered = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (Subscription s : table.subscriptions()) {
            if (!s.filter().matches(attributes)) continue;
            matched.add(s.name());
            inc(RouterMetrics.MATCHED, s);

            try {
                DeliveryOutcome outcome = targets.get(s.target()).deliver(s, copyOf(routed));
                if (outcome == DeliveryOutcome.DEAD_LETTERED) {
                    deadLettered.add(s.name());
                    inc(RouterMetrics.DEAD_LETTERED, s);
                } else {
                    delivered.add(s.name());
                    inc(RouterMetrics.DELIVERED, s);
                }
            } catch (RuntimeException e) {
                log.error("Delivery failed subscription={} target={} eventId={} orderId={}",
                        s.name(), s.target(), routed.envelope().getEventId(), routed.event().getOrderId(), e);
                failed.put(s.name(), e.toString());
                inc(RouterMetrics.FAILED, s);
            }
        }

        RoutingReport report = new RoutingReport(matched, delivered, deadLettered, failed);
        log.debug("Routed eventId={} eventType={} matched={} delivered={} deadLettered={} failed={}",
                routed.envelope().getEventId(), routed.event().getEventType(),
                matched, delivered, deadLettered, failed.keySet());
        return report;
    }

    public RoutingTable table() {
        return table;
    }

    // a subscriber may mutate the payload tree; siblings must not see that
    private static RoutedEvent copyOf(RoutedEvent r) {
        OrderEvent e = r.event();
        OrderEvent copy = e.getPayload() == null ? e : e.toBuilder().payload(e.getPayload().deepCopy()).build();
        EventEnvelope env = r.envelope().toBuilder()
                .attributes(r.envelope().getAttributes() == null
                        ? new LinkedHashMap<>() : new LinkedHashMap<>(r.envelope().getAttributes()))
                .payload(r.envelope().getPayload() == null ? null : r.envelope().getPayload().deepCopy())
                .build();
        return new RoutedEvent(copy, env);
    }

    private void inc(String metric, Subscription s) {
        if (metrics != null) metrics.inc(metric, s.name());
    }
}
