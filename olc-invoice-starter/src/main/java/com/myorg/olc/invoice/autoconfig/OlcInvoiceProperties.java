package com.myorg.olc.invoice.autoconfig;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "olc.invoice")
public class OlcInvoiceProperties {

    private boolean enabled = true;

    // how long an issued upload URL accepts the file
    private Duration uploadUrlTtl = Duration.ofMinutes(5);

    // ttl of the transaction row; a transaction still open when it expires is reported as TIMEOUT
    private Duration transactionTtl = Duration.ofMinutes(10);

    private String keyPrefix = "invoices/";

    private String uploadBaseUrl = "http://localhost:8080/uploads/";

    // durable queue between upload notifications and the import; blank imports inline
    private String uploadQueue = "invoice-uploads";

    // processing runs per transaction before it is FAILED; keep it at or below the upload queue's max-receive-count
    private int maxProcessingAttempts = 3;

    private Audit audit = new Audit();

    @Data
    public static class Audit {
        private String source = "app.invoice";

        // Kafka topic for audit events; unset logs them instead
        private String topic;
    }
}
