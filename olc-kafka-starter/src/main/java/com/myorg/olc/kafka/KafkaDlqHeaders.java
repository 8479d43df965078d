package com.myorg.olc.kafka;

public final class KafkaDlqHeaders {
    private KafkaDlqHeaders() {}

    public static final String REASON = "olc.dlq.reason";
    public static final String NON_RETRYABLE = "olc.dlq.non_retryable";

    public static final String EXCEPTION_CLASS = "olc.dlq.exception_class";
    public static final String EXCEPTION_MESSAGE = "olc.dlq.exception_message";

    public static final String SERVICE = "olc.dlq.service";
    public static final String TS_MS = "olc.dlq.ts_ms";
}
