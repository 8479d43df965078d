package com.myorg.olc.contracts.order;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.olc.contracts.core.exception.ValidationException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable fact about an order. Published once, consumed by any number of subscribers.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OrderEvent {
    OrderEventType eventType;
    String orderId;
    String requesterEmail;
    JsonNode payload;
    long timestamp; // epoch millis

    @JsonIgnore
    public Map<String, String> attributes() {
        Map<String, String> attrs = new LinkedHashMap<>();
        if (eventType != null) attrs.put(OrderEventAttributes.EVENT_TYPE, eventType.name());
        if (orderId != null) attrs.put(OrderEventAttributes.ORDER_ID, orderId);
        if (requesterEmail != null) attrs.put(OrderEventAttributes.REQUESTER_EMAIL, requesterEmail);
        return attrs;
    }

    /** Rejects events that cannot be routed or stored. */
    public OrderEvent validate() {
        if (eventType == null) throw new ValidationException("eventType is required");
        if (orderId == null || orderId.isBlank()) throw new ValidationException("orderId is required");
        if (orderId.contains("#")) throw new ValidationException("orderId must not contain '#'");
        if (requesterEmail == null || requesterEmail.isBlank()) {
            throw new ValidationException("requesterEmail is required");
        }
        if (timestamp <= 0) throw new ValidationException("timestamp must be positive");
        return this;
    }
}
