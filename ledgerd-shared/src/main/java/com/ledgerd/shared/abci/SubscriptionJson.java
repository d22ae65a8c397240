package com.ledgerd.shared.abci;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders and reads events in the JSON shape used by subscription responses:
 * {@code {"type": ..., "attributes": [{"key": ..., "value": ..., "index": ...}]}}.
 */
public final class SubscriptionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SubscriptionJson() {}

    public static JsonNode toJson(AbciEvent event) {
        return MAPPER.valueToTree(event);
    }

    public static String toJsonString(AbciEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.type(), e);
        }
    }

    /**
     * Reads a subscription payload into a JSON tree.
     */
    public static JsonNode readTree(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }
}
