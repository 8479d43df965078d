package com.myorg.olc.queue;

import com.myorg.olc.queue.autoconfig.OlcQueueProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDurableQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private QueueRegistry registry;
    private DurableQueue queue;

    @BeforeEach
    void setUp() {
        OlcQueueProperties props = new OlcQueueProperties();
        OlcQueueProperties.QueueSpec spec = new OlcQueueProperties.QueueSpec();
        spec.setMaxReceiveCount(2);
        spec.setDeadLetterQueue("orders-dlq");
        spec.setVisibilityTimeout(Duration.ofSeconds(10));
        props.getQueues().put("orders", spec);

        registry = new InMemoryQueueRegistry(props, clock);
        queue = registry.queue("orders");
    }

    @Test
    void receivedMessageIsHiddenUntilVisibilityDeadline() {
        queue.enqueue("a", Map.of());

        List<QueueMessage> first = queue.receiveBatch(5);
        assertThat(first).hasSize(1);
        assertThat(first.get(0).receiveCount()).isEqualTo(1);
        assertThat(queue.receiveBatch(5)).isEmpty();

        clock.advance(Duration.ofSeconds(11));
        List<QueueMessage> again = queue.receiveBatch(5);
        assertThat(again).hasSize(1);
        assertThat(again.get(0).receiveCount()).isEqualTo(2);
        assertThat(again.get(0).receiptHandle()).isNotEqualTo(first.get(0).receiptHandle());
    }

    @Test
    void staleReceiptCannotAcknowledge() {
        queue.enqueue("a", Map.of());
        QueueMessage first = queue.receiveBatch(1).get(0);
        clock.advance(Duration.ofSeconds(11));
        QueueMessage second = queue.receiveBatch(1).get(0);

        assertThat(queue.acknowledge(first.receiptHandle())).isFalse();
        assertThat(queue.acknowledge(second.receiptHandle())).isTrue();
        assertThat(queue.size()).isZero();
    }

    @Test
    void batchSizeIsBounded() {
        for (int i = 0; i < 7; i++) queue.enqueue("m" + i, Map.of());

        assertThat(queue.receiveBatch(5)).extracting(QueueMessage::body).containsExactly("m0", "m1", "m2", "m3", "m4");
        assertThat(queue.receiveBatch(5)).extracting(QueueMessage::body).containsExactly("m5", "m6");
    }

    @Test
    void messageOverItsBudgetMovesToDeadLetterQueueOnReceive() {
        queue.enqueue("{\"orderId\":\"o1\"}", Map.of("eventType", "ORDER_CREATED"));

        queue.receiveBatch(1);
        clock.advance(Duration.ofSeconds(11));
        queue.receiveBatch(1);
        clock.advance(Duration.ofSeconds(11));

        assertThat(queue.receiveBatch(1)).isEmpty();
        assertThat(queue.size()).isZero();

        DurableQueue dlq = registry.find("orders-dlq").orElseThrow();
        List<QueueMessage> dead = dlq.peek(10);
        assertThat(dead).hasSize(1);
        assertThat(dead.get(0).body()).isEqualTo("{\"orderId\":\"o1\"}");
        assertThat(dead.get(0).attributes())
                .containsEntry("eventType", "ORDER_CREATED")
                .containsEntry(DeadLetterAttributes.REASON, "MAX_RECEIVE_COUNT")
                .containsEntry(DeadLetterAttributes.SOURCE_QUEUE, "orders")
                .containsEntry(DeadLetterAttributes.RECEIVE_COUNT, "2");
    }

    @Test
    void peekDoesNotChangeDeliveryState() {
        queue.enqueue("a", Map.of());

        assertThat(queue.peek(10)).singleElement().extracting(QueueMessage::receiveCount).isEqualTo(0);
        assertThat(queue.receiveBatch(1)).hasSize(1);
    }
}
