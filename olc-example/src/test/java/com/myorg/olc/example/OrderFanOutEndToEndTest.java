package com.myorg.olc.example;

import com.myorg.olc.contracts.order.OrderEventType;
import com.myorg.olc.ledger.order.OrderEventLedger;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.queue.DeadLetterAttributes;
import com.myorg.olc.queue.QueueMessage;
import com.myorg.olc.queue.QueueRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.kafka.test.context.EmbeddedKafka;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "olc.kafka.bootstrap-servers=${spring.embedded.kafka.brokers}",
                "olc.kafka.consumer.group-id=olc-e2e",
                "olc.kafka.consumer.retry.backoff=100ms",
                "olc.eventing.topics.create=false",
                "olc.queue.consumer.poll-interval=100ms",
                "olc.queue.consumer.initial-delay=100ms",
                "olc.queue.queues.order-emails.visibility-timeout=200ms",
                "olc.ledger.sweeper.scheduling-enabled=false"
        }
)
@EmbeddedKafka(partitions = 1, topics = {"order-events", "order-events.DLQ"})
class OrderFanOutEndToEndTest {

    @Autowired
    TestRestTemplate rest;

    @Autowired
    MeterRegistry meters;

    @Autowired
    OrderEventLedger ledger;

    @Autowired
    QueueRegistry queues;

    @Test
    void createdOrderReachesBillingEmailAndLedger() {
        double billedBefore = count(BillingSubscriber.BILLED);
        double mailedBefore = count(OrderEmailConfig.SENT);

        ResponseEntity<Map> created = publish("ORDER_CREATED", "o-1", "jane@corp.com");
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(created.getBody()).containsKey("messageId");

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            assertThat(count(BillingSubscriber.BILLED)).isEqualTo(billedBefore + 1);
            assertThat(count(OrderEmailConfig.SENT)).isEqualTo(mailedBefore + 1);
            assertThat(entries("jane@corp.com", null))
                    .extracting(LedgerEntry::partitionKey)
                    .containsExactly("order#o-1");
        });

        publish("ORDER_DELETED", "o-1", "jane@corp.com");

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() ->
                assertThat(entries("jane@corp.com", null)).hasSize(2));
        assertThat(entries("jane@corp.com", OrderEventType.ORDER_DELETED)).hasSize(1);
        assertThat(count(BillingSubscriber.BILLED)).isEqualTo(billedBefore + 1);
        assertThat(count(OrderEmailConfig.SENT)).isEqualTo(mailedBefore + 1);
    }

    @Test
    void failingSubscribersDeadLetterWithoutBlockingTheLedger() {
        publish("ORDER_CREATED", "FAIL_1", "bob@corp.com");

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            assertThat(queues.queue("billing.DLQ").size()).isEqualTo(1);
            assertThat(queues.queue("order-emails-dlq").size()).isEqualTo(1);
            assertThat(entries("bob@corp.com", null)).hasSize(1);
        });

        QueueMessage dead = queues.queue("order-emails-dlq").peek(1).get(0);
        assertThat(dead.attributes()).containsEntry(DeadLetterAttributes.SOURCE_QUEUE, "order-emails");
        assertThat(dead.attributes().get(DeadLetterAttributes.RECEIVE_COUNT)).isEqualTo("3");
        assertThat(queues.queue("order-emails").size()).isZero();
    }

    @Test
    void invalidEventIsRejectedBeforePublishing() {
        ResponseEntity<Map> res = rest.postForEntity("/orders/events",
                Map.of("eventType", "ORDER_CREATED", "orderId", "o-9"), Map.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(String.valueOf(res.getBody().get("error"))).contains("requesterEmail");
    }

    @SuppressWarnings("rawtypes")
    private ResponseEntity<Map> publish(String type, String orderId, String email) {
        Map<String, Object> body = Map.of(
                "eventType", type,
                "orderId", orderId,
                "requesterEmail", email,
                "payload", Map.of("total", 42, "currency", "EUR"));
        return rest.postForEntity("/orders/events", body, Map.class);
    }

    private List<LedgerEntry> entries(String email, OrderEventType type) {
        List<LedgerEntry> out = new ArrayList<>();
        ledger.queryByRequester(email, type).forEach(out::add);
        return out;
    }

    private double count(String name) {
        return meters.counter(name).count();
    }
}
