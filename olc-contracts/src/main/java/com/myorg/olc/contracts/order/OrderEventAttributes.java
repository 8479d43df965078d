package com.myorg.olc.contracts.order;

// attribute names visible to subscription filters
public final class OrderEventAttributes {
    private OrderEventAttributes() {}

    public static final String EVENT_TYPE = "eventType";
    public static final String ORDER_ID = "orderId";
    public static final String REQUESTER_EMAIL = "requesterEmail";
}
