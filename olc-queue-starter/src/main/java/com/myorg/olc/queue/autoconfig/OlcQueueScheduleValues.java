package com.myorg.olc.queue.autoconfig;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class OlcQueueScheduleValues {
    private final OlcQueueProperties props;

    public long getPollIntervalMs() { return props.getConsumer().getPollInterval().toMillis(); }
    public long getInitialDelayMs() { return props.getConsumer().getInitialDelay().toMillis(); }
}
