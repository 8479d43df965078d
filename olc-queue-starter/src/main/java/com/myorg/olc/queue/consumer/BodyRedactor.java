package com.myorg.olc.queue.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Masks sensitive fields of a JSON message body before it is written to a log line.
 * Field names match case-insensitively at any depth.
 */
public class BodyRedactor {

    static final String MASK = "***";

    private final ObjectMapper mapper;
    private final Set<String> sensitiveFields;

    public BodyRedactor(ObjectMapper mapper, Collection<String> sensitiveFields) {
        this.mapper = mapper;
        this.sensitiveFields = sensitiveFields.stream()
                .map(f -> f.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public String redact(String body) {
        if (body == null) return null;
        try {
            JsonNode root = mapper.readTree(body);
            if (root == null || !root.isContainerNode()) {
                return "<non-JSON body, " + body.length() + " chars>";
            }
            mask(root);
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            // never echo a body we could not inspect
            return "<non-JSON body, " + body.length() + " chars>";
        }
    }

    private void mask(JsonNode node) {
        if (node instanceof ObjectNode obj) {
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (sensitiveFields.contains(name.toLowerCase(Locale.ROOT))) {
                    obj.set(name, TextNode.valueOf(MASK));
                } else {
                    mask(obj.get(name));
                }
            }
        } else if (node instanceof ArrayNode arr) {
            arr.forEach(this::mask);
        }
    }
}
