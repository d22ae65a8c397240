package com.ledgerd.shared.ledger.events;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Attributes of an event parsed from a subscription response.
 * Each value is meant to be consumed once, through {@link #take(String)}.
 */
public final class Attributes {

    private static final Logger log = LoggerFactory.getLogger(Attributes.class);

    private final Map<String, String> values;

    private Attributes(Map<String, String> values) {
        this.values = values;
    }

    /**
     * Parses the {@code attributes} array of an event JSON. A key that appears
     * more than once keeps its last value.
     *
     * @throws AttributesException if the array or a record's key or value is missing
     */
    public static Attributes parse(JsonNode json) throws AttributesException {
        Objects.requireNonNull(json, "Json cannot be null");
        JsonNode attrs = json.get("attributes");
        if (attrs == null || !attrs.isArray()) {
            log.debug("Event json has no attributes array: {}", json);
            throw new AttributesException(Reason.MISSING_ATTRIBUTES, null);
        }

        Map<String, String> values = new HashMap<>();
        for (JsonNode attr : attrs) {
            JsonNode key = attr.get("key");
            if (key == null || key.isNull()) {
                log.debug("Event attribute has no key: {}", attr);
                throw new AttributesException(Reason.MISSING_KEY, attr.toString());
            }
            JsonNode value = attr.get("value");
            if (value == null || value.isNull()) {
                log.debug("Event attribute has no value: {}", attr);
                throw new AttributesException(Reason.MISSING_VALUE, attr.toString());
            }
            values.put(text(key), text(value));
        }
        return new Attributes(values);
    }

    private static String text(JsonNode node) {
        return node.isTextual() ? node.textValue() : node.toString();
    }

    /**
     * Get a reference to the value associated with the key.
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Removes the value associated with the key and hands it to the caller.
     */
    public Optional<String> take(String key) {
        return Optional.ofNullable(values.remove(key));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return Map.copyOf(values);
    }

    @Override
    public String toString() {
        return "Attributes" + values;
    }

    /**
     * What was missing from the event json.
     */
    public enum Reason {
        MISSING_ATTRIBUTES,
        MISSING_KEY,
        MISSING_VALUE
    }

    /**
     * Error parsing attributes from an event json.
     */
    public static class AttributesException extends Exception {

        private final Reason reason;
        private final String context;

        public AttributesException(Reason reason, String context) {
            super(message(reason, context));
            this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
            this.context = context;
        }

        private static String message(Reason reason, String context) {
            return switch (reason) {
                case MISSING_ATTRIBUTES -> "Json missing `attributes` field";
                case MISSING_KEY -> "Attributes missing key: " + context;
                case MISSING_VALUE -> "Attributes missing value: " + context;
            };
        }

        public Reason reason() {
            return reason;
        }

        /**
         * The offending attribute record as json, absent for {@link Reason#MISSING_ATTRIBUTES}.
         */
        public Optional<String> context() {
            return Optional.ofNullable(context);
        }
    }
}
