package com.myorg.olc.eventing.routing.target;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;
import com.myorg.olc.eventing.routing.DeliveryOutcome;
import com.myorg.olc.eventing.routing.DeliveryTarget;
import com.myorg.olc.eventing.routing.RoutedEvent;
import com.myorg.olc.eventing.routing.Subscription;
import com.myorg.olc.eventing.routing.SubscriptionTarget;
import com.myorg.olc.eventing.subscriber.SubscriberMethodInvoker;
import com.myorg.olc.eventing.subscriber.SubscriberRegistry;
import com.myorg.olc.queue.DeadLetterAttributes;
import com.myorg.olc.queue.QueueRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.FixedBackOff;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Invokes the subscriber inline with fixed-backoff retries. When retries run out, or the failure is
 * non-retryable, the envelope goes to the subscription's dead-letter queue so nothing is lost.
 */
@Slf4j
public class DirectDeliveryTarget implements DeliveryTarget {

    static final String NO_SUBSCRIBER = "NO_SUBSCRIBER";
    static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";

    private final SubscriberRegistry subscribers;
    private final QueueRegistry queues;
    private final ObjectMapper mapper;
    private final Clock clock;

    public DirectDeliveryTarget(SubscriberRegistry subscribers, QueueRegistry queues, ObjectMapper mapper, Clock clock) {
        this.subscribers = subscribers;
        this.queues = queues;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public SubscriptionTarget kind() {
        return SubscriptionTarget.DIRECT;
    }

    @Override
    public DeliveryOutcome deliver(Subscription s, RoutedEvent routed) {
        SubscriberMethodInvoker invoker = subscribers.get(s.name());
        if (invoker == null) {
            log.error("No @OrderEventSubscriber for subscription={}, dead-lettering eventId={}",
                    s.name(), routed.envelope().getEventId());
            deadLetter(s, routed, NO_SUBSCRIBER, true, null, 0);
            return DeliveryOutcome.DEAD_LETTERED;
        }

        Subscription.Retry retry = s.retry();
        BackOffExecution backoff = new FixedBackOff(retry.backoff().toMillis(), retry.maxAttempts() - 1L).start();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                invoker.invoke(routed.envelope(), routed.event());
                return DeliveryOutcome.DELIVERED;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                deadLetter(s, routed, RETRY_EXHAUSTED, false, ie, attempt);
                return DeliveryOutcome.DEAD_LETTERED;
            } catch (Exception e) {
                if (e instanceof OlcNonRetryableException nre) {
                    log.warn("Subscriber rejected event subscription={} eventId={} reason={}",
                            s.name(), routed.envelope().getEventId(), nre.getReason());
                    deadLetter(s, routed, nre.getReason(), true, e, attempt);
                    return DeliveryOutcome.DEAD_LETTERED;
                }

                long wait = backoff.nextBackOff();
                if (wait == BackOffExecution.STOP) {
                    log.error("Subscriber failed after {} attempts subscription={} eventId={}",
                            attempt, s.name(), routed.envelope().getEventId(), e);
                    deadLetter(s, routed, RETRY_EXHAUSTED, false, e, attempt);
                    return DeliveryOutcome.DEAD_LETTERED;
                }
                log.warn("Subscriber failed subscription={} eventId={} attempt={} error={}",
                        s.name(), routed.envelope().getEventId(), attempt, e.toString());
                if (!sleep(wait)) {
                    deadLetter(s, routed, RETRY_EXHAUSTED, false, e, attempt);
                    return DeliveryOutcome.DEAD_LETTERED;
                }
            }
        }
    }

    private void deadLetter(Subscription s, RoutedEvent routed, String reason, boolean nonRetryable,
                            Throwable ex, int attempts) {
        Map<String, String> attrs = new HashMap<>(routed.event().attributes());
        attrs.put(DeadLetterAttributes.REASON, reason);
        attrs.put(DeadLetterAttributes.NON_RETRYABLE, String.valueOf(nonRetryable));
        attrs.put(DeadLetterAttributes.SOURCE_QUEUE, s.name());
        attrs.put(DeadLetterAttributes.RECEIVE_COUNT, String.valueOf(attempts));
        attrs.put(DeadLetterAttributes.TS_MS, String.valueOf(clock.millis()));
        if (ex != null) {
            Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
            attrs.put(DeadLetterAttributes.EXCEPTION_CLASS, root.getClass().getName());
            attrs.put(DeadLetterAttributes.EXCEPTION_MESSAGE, safeMsg(root.getMessage(), 512));
        }
        queues.queue(s.deadLetterQueue()).enqueue(toJson(routed), attrs);
    }

    private String toJson(RoutedEvent routed) {
        try {
            return mapper.writeValueAsString(routed.envelope());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize envelope eventId=" + routed.envelope().getEventId(), e);
        }
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String safeMsg(String msg, int maxLen) {
        if (msg == null) return "";
        return msg.length() <= maxLen ? msg : msg.substring(0, maxLen);
    }
}
