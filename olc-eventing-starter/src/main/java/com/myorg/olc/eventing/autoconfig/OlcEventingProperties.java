package com.myorg.olc.eventing.autoconfig;

import com.myorg.olc.eventing.routing.SubscriptionTarget;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "olc.eventing")
public class OlcEventingProperties {
    // blank -> spring.application.name
    private String producerName;
    // topic the publisher writes to
    private String topic = "order-events";
    // serialized envelope limit, checked before sending
    private int maxMessageBytes = 256 * 1024;

    private Listener listener = new Listener();
    // topics the listener subscribes to
    private List<String> consumeTopics = new ArrayList<>();
    // eventType without an OrderEventType: true=log+skip, false=throw (record goes to the DLT)
    private boolean ignoreUnknownEventType = true;

    private Topics topics = new Topics();
    private Routing routing = new Routing();

    @Data
    public static class Listener {
        private boolean enabled = true;
    }

    @Data
    public static class Topics {
        // declare the order-events topic (and its .DLQ) through KafkaAdmin
        private boolean create = false;
        private int partitions = 3;
        private short replicas = 1;
    }

    @Data
    public static class Routing {
        private List<SubscriptionSpec> subscriptions = new ArrayList<>();
    }

    @Data
    public static class SubscriptionSpec {
        private String name;
        // SpEL over eventType / orderId / requesterEmail; blank matches everything
        private String filter;
        private SubscriptionTarget target;
        // QUEUE target only
        private String queue;
        private RetrySpec retry = new RetrySpec();
    }

    @Data
    public static class RetrySpec {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(200);
    }
}
