package com.myorg.olc.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.listener.RetryListener;

/**
 * Logs and counts retry / dead-letter / recovery-failure events of a {@code DefaultErrorHandler}.
 * Base meters are pre-registered at 0 by the error handling auto-configuration.
 */
@Slf4j
public class KafkaRetryDlqMetricsListener implements RetryListener {

    public static final String RETRY = "olc.kafka.retry";
    public static final String DLQ = "olc.kafka.dlq";
    public static final String RECOVERY_FAILED = "olc.kafka.recovery_failed";

    private final String service;
    private final ObjectProvider<MeterRegistry> registryProvider;

    public KafkaRetryDlqMetricsListener(String service, ObjectProvider<MeterRegistry> registryProvider) {
        this.service = service;
        this.registryProvider = registryProvider;
    }

    @Override
    public void failedDelivery(ConsumerRecord<?, ?> record, Exception ex, int deliveryAttempt) {
        log.warn("Retrying topic={} partition={} offset={} attempt={} error={}",
                record.topic(), record.partition(), record.offset(), deliveryAttempt, ex.toString());
        inc(RETRY, record.topic(), ex);
    }

    @Override
    public void recovered(ConsumerRecord<?, ?> record, Exception ex) {
        log.error("Recovered (sent to DLQ) topic={} partition={} offset={} error={}",
                record.topic(), record.partition(), record.offset(), ex.toString());
        inc(DLQ, record.topic(), ex);
    }

    @Override
    public void recoveryFailed(ConsumerRecord<?, ?> record, Exception original, Exception failure) {
        log.error("Recovery FAILED topic={} partition={} offset={} originalError={}",
                record.topic(), record.partition(), record.offset(), original.toString(), failure);
        inc(RECOVERY_FAILED, record.topic(), failure);
    }

    private void inc(String metric, String topic, Exception ex) {
        MeterRegistry registry = registryProvider.getIfAvailable();
        if (registry == null) return;

        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        Counter.builder(metric)
                .tag("service", service)
                .tag("topic", topic)
                .tag("exception", root.getClass().getSimpleName())
                .register(registry)
                .increment();
    }
}
