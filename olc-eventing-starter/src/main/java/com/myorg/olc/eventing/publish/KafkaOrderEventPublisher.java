package com.myorg.olc.eventing.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.conventions.CoreHeaders;
import com.myorg.olc.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.order.OrderEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Slf4j
@RequiredArgsConstructor
public class KafkaOrderEventPublisher implements OrderEventPublisher {

    static final int ENVELOPE_VERSION = 1;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ObjectMapper mapper;
    private final String topic;
    private final String producerName;
    private final int maxMessageBytes;

    @Override
    public CompletableFuture<String> publish(OrderEvent event) {
        event.validate();

        EventEnvelope env = EnvelopeBuilder.wrap(
                mapper,
                event.getEventType().name(),
                ENVELOPE_VERSION,
                event.getOrderId(),
                event.getOrderId(),
                null,
                producerName,
                event.attributes(),
                event
        );

        int size = serializedSize(env);
        if (size > maxMessageBytes) {
            throw new PublishException("Envelope for orderId=" + event.getOrderId() + " is " + size
                    + " bytes, limit is " + maxMessageBytes);
        }

        // orderId as key: all events of one order land on one partition, in publish order
        ProducerRecord<String, Object> record = new ProducerRecord<>(topic, event.getOrderId(), env);
        addHeader(record, CoreHeaders.EVENT_ID, env.getEventId());
        addHeader(record, CoreHeaders.EVENT_TYPE, env.getEventType());
        addHeader(record, CoreHeaders.CORRELATION_ID, env.getCorrelationId());
        addHeader(record, CoreHeaders.CAUSATION_ID, env.getCausationId());
        env.getAttributes().forEach((k, v) -> addHeader(record, CoreHeaders.attribute(k), v));

        CompletableFuture<?> sent;
        try {
            sent = kafkaTemplate.send(record);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new PublishException("Publish failed topic=" + topic + " orderId=" + event.getOrderId(), e));
        }

        return sent.handle((r, ex) -> {
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                throw new CompletionException(
                        new PublishException("Publish failed topic=" + topic + " orderId=" + event.getOrderId(), cause));
            }
            log.debug("Published eventId={} eventType={} orderId={}", env.getEventId(), env.getEventType(), event.getOrderId());
            return env.getEventId();
        });
    }

    private int serializedSize(EventEnvelope env) {
        try {
            return mapper.writeValueAsBytes(env).length;
        } catch (JsonProcessingException e) {
            throw new PublishException("Cannot serialize envelope eventType=" + env.getEventType(), e);
        }
    }

    private static void addHeader(ProducerRecord<String, Object> record, String key, String value) {
        if (StringUtils.hasText(value)) {
            record.headers().add(new RecordHeader(key, value.getBytes(StandardCharsets.UTF_8)));
        }
    }
}
