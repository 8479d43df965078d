package com.myorg.olc.ledger.autoconfig;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "olc.ledger")
public class OlcLedgerProperties {

    // auto: Redis when a StringRedisTemplate bean exists, otherwise memory
    // redis: Redis is mandatory (startup fails without the dependency)
    // memory: always in-memory (single instance only)
    private String store = "auto";

    private String keyPrefix = "olc:ledger:";

    // page size of secondary-index queries
    private int pageSize = 25;

    // ttl for order event rows; unset keeps them forever
    private Duration orderEventTtl;

    private Sweeper sweeper = new Sweeper();

    @Data
    public static class Sweeper {
        private boolean enabled = true;
        private boolean schedulingEnabled = true;
        private Duration interval = Duration.ofSeconds(10);
        private Duration initialDelay = Duration.ofSeconds(5);
    }
}
