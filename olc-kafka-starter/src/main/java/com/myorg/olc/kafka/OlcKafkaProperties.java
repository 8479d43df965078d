package com.myorg.olc.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "olc.kafka")
public class OlcKafkaProperties {
    private String bootstrapServers = "localhost:9092";
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Dlq dlq = new Dlq();

    @Data
    public static class Producer {
        private String acks = "all";
        private boolean idempotence = true;
        private int retries = 10;
        private int maxInFlight = 5;
        private String compression = "snappy";
        private int lingerMs = 5;
        private int batchSize = 65536;
        /** Kafka max.request.size; the publisher enforces its own, smaller envelope limit. */
        private int maxRequestSize = 1048576;
    }

    @Data
    public static class Consumer {
        private String groupId;
        /**
         * Kafka consumer auto.offset.reset (earliest/latest/none).
         */
        private String autoOffsetReset = "earliest";
        private int concurrency = 3;
        private int maxPollRecords = 500;
        /** Packages the JSON deserializer may instantiate. */
        private String trustedPackages = "com.myorg.olc.contracts.*";
        private final Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int attempts = 3;
        private Duration backoff = Duration.ofMillis(200);
    }

    @Data
    public static class Dlq {
        private boolean enabled = true;
        private String suffix = ".DLQ";
    }
}
