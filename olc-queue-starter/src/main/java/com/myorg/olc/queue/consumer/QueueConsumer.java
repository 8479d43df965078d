package com.myorg.olc.queue.consumer;

import com.myorg.olc.queue.DeadLetterAttributes;
import com.myorg.olc.queue.DeadLetterPolicy;
import com.myorg.olc.queue.DurableQueue;
import com.myorg.olc.queue.MessageHandler;
import com.myorg.olc.queue.QueueMessage;
import com.myorg.olc.queue.autoconfig.OlcQueueProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls one bounded batch per {@link #runOnce()} and runs every message on the worker pool.
 * Each message is settled on its own: a failing sibling never delays another's acknowledgement.
 */
@Slf4j
@RequiredArgsConstructor
public class QueueConsumer {

    private enum Settlement { ACKNOWLEDGED, RETRY, DEAD_LETTERED }

    private final DurableQueue queue;
    private final MessageHandler handler;
    private final OlcQueueProperties.Consumer settings;
    private final ExecutorService workers;
    private final DeadLetterReasonClassifier classifier;
    private final BodyRedactor redactor;
    private final Clock clock;
    private final QueueMetrics metrics; // may be null

    public String queueName() {
        return queue.name();
    }

    public BatchResult runOnce() {
        List<QueueMessage> batch = queue.receiveBatch(settings.getBatchSize());
        if (batch.isEmpty()) return BatchResult.EMPTY;

        Map<QueueMessage, Future<?>> running = new LinkedHashMap<>();
        for (QueueMessage m : batch) {
            running.put(m, workers.submit(() -> {
                handler.handle(m);
                return null;
            }));
        }

        long deadline = System.nanoTime() + settings.getInvocationTimeout().toNanos();
        int acked = 0, retried = 0, dead = 0;

        for (Map.Entry<QueueMessage, Future<?>> e : running.entrySet()) {
            Settlement s = settle(e.getKey(), e.getValue(), deadline);
            switch (s) {
                case ACKNOWLEDGED -> acked++;
                case RETRY -> retried++;
                case DEAD_LETTERED -> dead++;
            }
        }
        return new BatchResult(batch.size(), acked, retried, dead);
    }

    private Settlement settle(QueueMessage m, Future<?> f, long deadlineNanos) {
        try {
            f.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            if (metrics != null) metrics.incTimeout(queue.name());
            return onFailure(m, new InvocationTimeoutException(
                    "Handler exceeded " + settings.getInvocationTimeout() + " for messageId=" + m.messageId()));
        } catch (ExecutionException ee) {
            return onFailure(m, ee.getCause() != null ? ee.getCause() : ee);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            // no verdict: the message becomes visible again after its deadline
            return Settlement.RETRY;
        }

        if (!queue.acknowledge(m.receiptHandle())) {
            log.warn("Late acknowledgement ignored queue={} messageId={} (visibility expired, redelivered)",
                    queue.name(), m.messageId());
            return Settlement.RETRY;
        }
        if (metrics != null) metrics.incAcknowledged(queue.name());
        return Settlement.ACKNOWLEDGED;
    }

    private Settlement onFailure(QueueMessage m, Throwable ex) {
        DeadLetterReasonClassifier.Decision decision = classifier.classify(m, ex);
        Optional<DeadLetterPolicy> policy = queue.deadLetterPolicy();

        log.warn("Queue handler failed queue={} messageId={} receiveCount={} reason={} body={}",
                queue.name(), m.messageId(), m.receiveCount(), decision.reason(), redactor.redact(m.body()), ex);

        boolean exhausted = policy.isPresent() && m.receiveCount() >= policy.get().maxReceiveCount();
        if (policy.isPresent() && (decision.nonRetryable() || exhausted)) {
            if (queue.deadLetter(m.receiptHandle(), dlqAttributes(decision, ex))) {
                if (metrics != null) metrics.incDeadLettered(queue.name());
                return Settlement.DEAD_LETTERED;
            }
            return Settlement.RETRY;
        }

        if (settings.getBackoff().isEnabled()) {
            queue.changeVisibility(m.receiptHandle(), backoff(m.receiveCount()));
        }
        if (metrics != null) metrics.incRetried(queue.name());
        return Settlement.RETRY;
    }

    private Map<String, String> dlqAttributes(DeadLetterReasonClassifier.Decision decision, Throwable ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        Map<String, String> attrs = new HashMap<>();
        attrs.put(DeadLetterAttributes.REASON, decision.reason());
        attrs.put(DeadLetterAttributes.NON_RETRYABLE, String.valueOf(decision.nonRetryable()));
        attrs.put(DeadLetterAttributes.EXCEPTION_CLASS, root.getClass().getName());
        attrs.put(DeadLetterAttributes.EXCEPTION_MESSAGE, safeMsg(root.getMessage(), 512));
        attrs.put(DeadLetterAttributes.TS_MS, String.valueOf(clock.millis()));
        return attrs;
    }

    /** receiveCount=1 => base, receiveCount=2 => 2*base, ... */
    private Duration backoff(int receiveCount) {
        long baseMs = Math.max(1, settings.getBackoff().getBase().toMillis());
        int pow = Math.max(0, receiveCount - 1);
        long ms = baseMs * (1L << Math.min(30, pow));
        return Duration.ofMillis(Math.min(ms, settings.getBackoff().getMax().toMillis()));
    }

    private static String safeMsg(String msg, int maxLen) {
        if (msg == null) return "";
        return msg.length() <= maxLen ? msg : msg.substring(0, maxLen);
    }
}
