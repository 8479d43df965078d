package com.myorg.olc.eventing.routing.target;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.conventions.CoreHeaders;
import com.myorg.olc.eventing.routing.DeliveryOutcome;
import com.myorg.olc.eventing.routing.DeliveryTarget;
import com.myorg.olc.eventing.routing.RoutedEvent;
import com.myorg.olc.eventing.routing.Subscription;
import com.myorg.olc.eventing.routing.SubscriptionTarget;
import com.myorg.olc.queue.QueueRegistry;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/** Enqueues the envelope JSON; the queue's own consumer takes it from there. */
@RequiredArgsConstructor
public class QueueDeliveryTarget implements DeliveryTarget {

    private final QueueRegistry queues;
    private final ObjectMapper mapper;

    @Override
    public SubscriptionTarget kind() {
        return SubscriptionTarget.QUEUE;
    }

    @Override
    public DeliveryOutcome deliver(Subscription s, RoutedEvent routed) {
        Map<String, String> attrs = new HashMap<>(routed.event().attributes());
        attrs.put(CoreHeaders.EVENT_ID, routed.envelope().getEventId());
        try {
            queues.queue(s.queue()).enqueue(mapper.writeValueAsString(routed.envelope()), attrs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize envelope eventId=" + routed.envelope().getEventId(), e);
        }
        return DeliveryOutcome.DELIVERED;
    }
}
