package com.ledgerd.shared.abci;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One attribute of an ABCI event.
 *
 * @param key   attribute name
 * @param value attribute value
 * @param index whether the consensus engine indexes the attribute for subscriber queries
 */
@JsonPropertyOrder({"key", "value", "index"})
public record AbciEventAttribute(
        @JsonProperty("key") String key,
        @JsonProperty("value") String value,
        @JsonProperty("index") boolean index
) {
    public AbciEventAttribute {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public static AbciEventAttribute indexed(String key, String value) {
        return new AbciEventAttribute(key, value, true);
    }
}
