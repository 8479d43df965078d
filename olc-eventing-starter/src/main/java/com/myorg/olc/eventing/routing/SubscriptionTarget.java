package com.myorg.olc.eventing.routing;

public enum SubscriptionTarget {
    /** In-process subscriber method, retried inline, dead-lettered to {@code <name>.DLQ}. */
    DIRECT,
    /** Envelope JSON enqueued on a durable queue. */
    QUEUE,
    /** Write-once append to the order event ledger. */
    LEDGER
}
