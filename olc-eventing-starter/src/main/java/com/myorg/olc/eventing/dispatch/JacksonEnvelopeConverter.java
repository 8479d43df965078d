package com.myorg.olc.eventing.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.core.exception.PoisonMessageException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.support.KafkaNull;

import java.util.Map;

public class JacksonEnvelopeConverter implements EnvelopeConverter {

    private final ObjectMapper mapper;

    public JacksonEnvelopeConverter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public EventEnvelope toEnvelope(Object value) {
        if (value == null || value == KafkaNull.INSTANCE) return null;

        if (value instanceof EventEnvelope env) return env;
        if (value instanceof ConsumerRecord<?, ?> rec) return toEnvelope(rec.value());

        try {
            if (value instanceof JsonNode node) {
                return mapper.treeToValue(node, EventEnvelope.class);
            }
            if (value instanceof Map<?, ?> map) {
                return mapper.convertValue(map, EventEnvelope.class);
            }
            if (value instanceof String s) {
                return mapper.readValue(s, EventEnvelope.class);
            }
            if (value instanceof byte[] bytes) {
                return mapper.readValue(bytes, EventEnvelope.class);
            }
            return mapper.convertValue(value, EventEnvelope.class);
        } catch (Exception e) {
            throw new PoisonMessageException("Cannot convert value to EventEnvelope, valueType=" + value.getClass(), e);
        }
    }
}
