package com.myorg.olc.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@UtilityClass
public class EnvelopeBuilder {

    public static EventEnvelope wrap(ObjectMapper mapper,
                                     String eventType,
                                     int version,
                                     String aggregateId,
                                     String correlationId,
                                     String causationId,
                                     String producer,
                                     Map<String, String> attributes,
                                     Object payloadObj) {
        return EventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .version(version)
                .aggregateId(aggregateId)
                .correlationId(correlationId)
                .causationId(causationId)
                .occurredAtMs(System.currentTimeMillis())
                .producer(producer)
                .attributes(attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes))
                .payload(mapper.valueToTree(payloadObj))
                .build();
    }
}
