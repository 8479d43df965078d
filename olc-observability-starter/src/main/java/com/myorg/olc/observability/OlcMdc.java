package com.myorg.olc.observability;

import org.slf4j.MDC;

public final class OlcMdc {

    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String ORDER_ID = "orderId";
    public static final String CORRELATION_ID = "corrId";
    public static final String PRODUCER = "producer";

    private OlcMdc() {
    }

    public static void put(OlcContext c) {
        if (c == null) return;
        if (c.eventId() != null) MDC.put(EVENT_ID, c.eventId());
        if (c.eventType() != null) MDC.put(EVENT_TYPE, c.eventType());
        if (c.orderId() != null) MDC.put(ORDER_ID, c.orderId());
        if (c.correlationId() != null) MDC.put(CORRELATION_ID, c.correlationId());
        if (c.producer() != null) MDC.put(PRODUCER, c.producer());
    }

    public static void clear() {
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_TYPE);
        MDC.remove(ORDER_ID);
        MDC.remove(CORRELATION_ID);
        MDC.remove(PRODUCER);
    }
}
