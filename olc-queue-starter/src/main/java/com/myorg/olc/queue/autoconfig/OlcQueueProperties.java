package com.myorg.olc.queue.autoconfig;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "olc.queue")
public class OlcQueueProperties {

    // auto | memory | redis; auto picks redis when a StringRedisTemplate bean exists
    private String store = "auto";

    private String keyPrefix = "olc:queue:";

    // used by queues that do not declare their own
    private Duration defaultVisibilityTimeout = Duration.ofSeconds(30);

    // queue name -> settings; a queue without dead-letter-queue keeps failing messages forever
    private Map<String, QueueSpec> queues = new LinkedHashMap<>();

    private Consumer consumer = new Consumer();

    // field names masked when a message body is logged
    private List<String> redactedFields = new ArrayList<>(List.of(
            "email", "requesterEmail", "payment", "cardNumber", "password"));

    private boolean metricsEnabled = true;

    @Data
    public static class QueueSpec {
        private int maxReceiveCount = 3;
        private String deadLetterQueue;
        private Duration visibilityTimeout;
    }

    @Data
    public static class Consumer {
        private boolean enabled = true;
        private boolean schedulingEnabled = true;

        private int batchSize = 5;
        private Duration invocationTimeout = Duration.ofSeconds(30);
        private int workerThreads = 10;

        private Duration pollInterval = Duration.ofMillis(500);
        private Duration initialDelay = Duration.ofSeconds(1);

        private Backoff backoff = new Backoff();
    }

    @Data
    public static class Backoff {
        // false: a failed message comes back when its visibility timeout runs out
        private boolean enabled = false;
        private Duration base = Duration.ofSeconds(1);
        private Duration max = Duration.ofMinutes(1);
    }
}
