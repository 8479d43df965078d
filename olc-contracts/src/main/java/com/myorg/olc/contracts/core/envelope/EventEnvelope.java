package com.myorg.olc.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {
    private String eventId; // UUID
    private String eventType;  // e.g. "ORDER_CREATED"
    private int version;  // 1

    private String aggregateId; // orderId
    private String correlationId;
    private String causationId;  // optional

    private long occurredAtMs; // epoch millis
    private String producer; // service name (optional)

    // routing attributes, evaluated by subscription filters
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    private JsonNode payload;
    private ErrorInfo error; // optional
}
