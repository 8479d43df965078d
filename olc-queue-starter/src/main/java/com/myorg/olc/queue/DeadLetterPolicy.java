package com.myorg.olc.queue;

public record DeadLetterPolicy(int maxReceiveCount, String deadLetterQueue) {
    public DeadLetterPolicy {
        if (maxReceiveCount < 1) throw new IllegalArgumentException("maxReceiveCount must be >= 1");
        if (deadLetterQueue == null || deadLetterQueue.isBlank()) {
            throw new IllegalArgumentException("deadLetterQueue is required");
        }
    }
}
