package com.myorg.olc.contracts.order;

public enum OrderEventType {
    ORDER_CREATED,
    ORDER_DELETED
}
