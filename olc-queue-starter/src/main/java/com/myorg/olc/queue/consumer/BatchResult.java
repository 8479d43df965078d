package com.myorg.olc.queue.consumer;

public record BatchResult(int received, int acknowledged, int retried, int deadLettered) {
    public static final BatchResult EMPTY = new BatchResult(0, 0, 0, 0);
}
