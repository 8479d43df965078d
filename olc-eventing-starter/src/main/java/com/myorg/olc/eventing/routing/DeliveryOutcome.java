package com.myorg.olc.eventing.routing;

public enum DeliveryOutcome {
    DELIVERED,
    DEAD_LETTERED
}
