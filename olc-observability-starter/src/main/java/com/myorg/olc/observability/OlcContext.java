package com.myorg.olc.observability;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;

public record OlcContext(
        String eventId,
        String eventType,
        String orderId,
        String correlationId,
        String producer
) {
    public static OlcContext of(EventEnvelope env) {
        if (env == null) return null;
        return new OlcContext(env.getEventId(), env.getEventType(), env.getAggregateId(),
                env.getCorrelationId(), env.getProducer());
    }
}
