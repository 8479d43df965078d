package com.myorg.olc.eventing.routing;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.order.OrderEvent;

/** The decoded event plus the envelope it travelled in. */
public record RoutedEvent(OrderEvent event, EventEnvelope envelope) {
}
