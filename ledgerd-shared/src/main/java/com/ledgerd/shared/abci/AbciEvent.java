package com.ledgerd.shared.abci;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * The consensus engine's generic event, as returned from block finalization
 * and delivered to subscribers.
 */
@JsonPropertyOrder({"type", "attributes"})
public record AbciEvent(
        @JsonProperty("type") String type,
        @JsonProperty("attributes") List<AbciEventAttribute> attributes
) {
    public AbciEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }
}
