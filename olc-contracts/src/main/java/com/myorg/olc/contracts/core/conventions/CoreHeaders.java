package com.myorg.olc.contracts.core.conventions;

public final class CoreHeaders {
    private CoreHeaders() {}

    public static final String CORRELATION_ID = "olc-correlation-id";
    public static final String EVENT_ID = "olc-event-id";
    public static final String EVENT_TYPE = "olc-event-type";
    public static final String CAUSATION_ID = "olc-causation-id";

    /** Each routing attribute travels as a header named {@code olc-attr-<name>}. */
    public static final String ATTRIBUTE_PREFIX = "olc-attr-";

    public static String attribute(String name) {
        return ATTRIBUTE_PREFIX + name;
    }
}
