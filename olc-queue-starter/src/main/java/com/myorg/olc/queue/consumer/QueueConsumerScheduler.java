package com.myorg.olc.queue.consumer;

import com.myorg.olc.queue.autoconfig.OlcQueueProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.concurrent.ExecutorService;

@Slf4j
@RequiredArgsConstructor
public class QueueConsumerScheduler implements AutoCloseable {

    private final OlcQueueProperties props;
    private final List<QueueConsumer> consumers;
    private final ExecutorService workers;

    @Scheduled(
            initialDelayString = "#{@olcQueueSchedule.initialDelayMs}",
            fixedDelayString = "#{@olcQueueSchedule.pollIntervalMs}"
    )
    public void scheduledLoop() {
        if (!props.getConsumer().isEnabled()) return;
        if (!props.getConsumer().isSchedulingEnabled()) return;
        runOnce();
    }

    public void runOnce() {
        for (QueueConsumer c : consumers) {
            try {
                BatchResult r = c.runOnce();
                if (r.received() > 0) {
                    log.debug("Queue batch queue={} received={} acked={} retried={} deadLettered={}",
                            c.queueName(), r.received(), r.acknowledged(), r.retried(), r.deadLettered());
                }
            } catch (RuntimeException e) {
                log.error("Queue poll failed queue={}", c.queueName(), e);
            }
        }
    }

    public List<QueueConsumer> consumers() {
        return consumers;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
