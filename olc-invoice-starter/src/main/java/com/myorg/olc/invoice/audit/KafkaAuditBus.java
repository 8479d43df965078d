package com.myorg.olc.invoice.audit;

import com.myorg.olc.contracts.audit.AuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Publishes audit events to a Kafka topic keyed by detail type. Send failures are logged, never thrown.
 */
@Slf4j
public class KafkaAuditBus implements AuditBus {

    private final KafkaTemplate<String, Object> template;
    private final String topic;

    public KafkaAuditBus(KafkaTemplate<String, Object> template, String topic) {
        this.template = template;
        this.topic = topic;
    }

    @Override
    public void publish(AuditEvent event) {
        try {
            template.send(topic, event.getDetailType(), event).whenComplete((r, ex) -> {
                if (ex != null) {
                    log.warn("Audit publish failed topic={} detailType={} error={}", topic, event.getDetailType(), ex.toString());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Audit publish failed topic={} detailType={} error={}", topic, event.getDetailType(), e.toString());
        }
    }
}
