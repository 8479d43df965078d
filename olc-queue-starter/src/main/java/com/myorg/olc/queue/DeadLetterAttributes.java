package com.myorg.olc.queue;

// attributes added to a message when it is moved to a dead-letter queue
public final class DeadLetterAttributes {
    private DeadLetterAttributes() {}

    public static final String REASON = "olc.dlq.reason";
    public static final String NON_RETRYABLE = "olc.dlq.non_retryable";

    public static final String EXCEPTION_CLASS = "olc.dlq.exception_class";
    public static final String EXCEPTION_MESSAGE = "olc.dlq.exception_message";

    public static final String SOURCE_QUEUE = "olc.dlq.source_queue";
    public static final String RECEIVE_COUNT = "olc.dlq.receive_count";
    public static final String TS_MS = "olc.dlq.ts_ms";
}
