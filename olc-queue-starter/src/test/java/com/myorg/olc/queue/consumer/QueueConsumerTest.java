package com.myorg.olc.queue.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.PoisonMessageException;
import com.myorg.olc.queue.DeadLetterAttributes;
import com.myorg.olc.queue.DurableQueue;
import com.myorg.olc.queue.InMemoryQueueRegistry;
import com.myorg.olc.queue.MessageHandler;
import com.myorg.olc.queue.MutableClock;
import com.myorg.olc.queue.QueueMessage;
import com.myorg.olc.queue.QueueRegistry;
import com.myorg.olc.queue.autoconfig.OlcQueueProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class QueueConsumerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final ExecutorService workers = Executors.newFixedThreadPool(5);
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final OlcQueueProperties props = new OlcQueueProperties();
    private QueueRegistry registry;
    private DurableQueue queue;

    @BeforeEach
    void setUp() {
        OlcQueueProperties.QueueSpec spec = new OlcQueueProperties.QueueSpec();
        spec.setMaxReceiveCount(3);
        spec.setDeadLetterQueue("emails-dlq");
        spec.setVisibilityTimeout(Duration.ofSeconds(30));
        props.getQueues().put("emails", spec);
        props.getConsumer().setInvocationTimeout(Duration.ofSeconds(5));

        registry = new InMemoryQueueRegistry(props, clock);
        queue = registry.queue("emails");
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void failingMessageIsDeadLetteredAfterExactlyMaxReceiveCountAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        QueueConsumer consumer = consumer(m -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("smtp down");
        });
        queue.enqueue("{\"requesterEmail\":\"a@b.c\"}", Map.of());

        for (int i = 0; i < 5; i++) {
            consumer.runOnce();
            clock.advance(Duration.ofSeconds(31));
        }

        assertThat(attempts).hasValue(3);
        assertThat(queue.size()).isZero();
        List<QueueMessage> dead = registry.queue("emails-dlq").peek(10);
        assertThat(dead).hasSize(1);
        assertThat(dead.get(0).attributes())
                .containsEntry(DeadLetterAttributes.REASON, DeadLetterReason.RETRY_EXHAUSTED.code())
                .containsEntry(DeadLetterAttributes.EXCEPTION_CLASS, IllegalStateException.class.getName());
        assertThat(meters.counter("olc.queue.dead_lettered", "queue", "emails").count()).isEqualTo(1.0);
    }

    @Test
    void oneFailureDoesNotBlockSiblingsInTheBatch() {
        QueueConsumer consumer = consumer(m -> {
            if (m.body().equals("bad")) throw new IllegalArgumentException("boom");
        });
        queue.enqueue("ok-1", Map.of());
        queue.enqueue("bad", Map.of());
        queue.enqueue("ok-2", Map.of());

        BatchResult r = consumer.runOnce();

        assertThat(r).isEqualTo(new BatchResult(3, 2, 1, 0));
        assertThat(queue.peek(10)).extracting(QueueMessage::body).containsExactly("bad");
    }

    @Test
    void nonRetryableFailureIsDeadLetteredImmediately() {
        QueueConsumer consumer = consumer(m -> {
            throw new PoisonMessageException("cannot parse invoice file");
        });
        queue.enqueue("poison", Map.of());

        BatchResult r = consumer.runOnce();

        assertThat(r.deadLettered()).isEqualTo(1);
        assertThat(registry.queue("emails-dlq").peek(1).get(0).attributes())
                .containsEntry(DeadLetterAttributes.REASON, "POISON_MESSAGE")
                .containsEntry(DeadLetterAttributes.NON_RETRYABLE, "true");
    }

    @Test
    void timeoutCountsAsFailedAttempt() {
        props.getConsumer().setInvocationTimeout(Duration.ofMillis(100));
        QueueConsumer consumer = consumer(m -> Thread.sleep(5_000));
        queue.enqueue("slow", Map.of());

        BatchResult r = consumer.runOnce();

        assertThat(r.retried()).isEqualTo(1);
        assertThat(queue.size()).isEqualTo(1);
        assertThat(meters.counter("olc.queue.timeout", "queue", "emails").count()).isEqualTo(1.0);
    }

    @Test
    void backoffDelaysRedelivery() {
        props.getConsumer().getBackoff().setEnabled(true);
        props.getConsumer().getBackoff().setBase(Duration.ofSeconds(2));
        QueueConsumer consumer = consumer(m -> {
            throw new IllegalStateException("later");
        });
        queue.enqueue("x", Map.of());

        consumer.runOnce();
        clock.advance(Duration.ofSeconds(1));
        assertThat(queue.receiveBatch(1)).isEmpty();
        clock.advance(Duration.ofSeconds(2));
        assertThat(queue.receiveBatch(1)).hasSize(1);
    }

    private QueueConsumer consumer(MessageHandler handler) {
        QueueMetrics metrics = new QueueMetrics(meters, registry);
        metrics.preRegister();
        return new QueueConsumer(queue, handler, props.getConsumer(), workers,
                new DefaultDeadLetterReasonClassifier(), new BodyRedactor(new ObjectMapper(), props.getRedactedFields()),
                clock, metrics);
    }
}
