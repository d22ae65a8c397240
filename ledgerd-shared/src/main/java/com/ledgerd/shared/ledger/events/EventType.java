package com.ledgerd.shared.ledger.events;

import java.util.Objects;

/**
 * Why an event exists. {@link #toString()} is the canonical rendering used
 * verbatim as the type of the emitted ABCI event, and is what subscribers
 * query on.
 */
public sealed interface EventType permits EventType.Accepted, EventType.Applied, EventType.Ibc, EventType.Proposal {

    EventType ACCEPTED = new Accepted();
    EventType APPLIED = new Applied();
    EventType PROPOSAL = new Proposal();

    static EventType ibc(String subType) {
        return new Ibc(subType);
    }

    /** The transaction was accepted to be included in a block. */
    record Accepted() implements EventType {
        @Override
        public String toString() {
            return "accepted";
        }
    }

    /** The transaction was applied during block finalization. */
    record Applied() implements EventType {
        @Override
        public String toString() {
            return "applied";
        }
    }

    /**
     * An IBC transaction was applied during block finalization.
     * Rendered as the IBC event's own type.
     */
    record Ibc(String subType) implements EventType {
        public Ibc {
            Objects.requireNonNull(subType, "IBC event type cannot be null");
        }

        @Override
        public String toString() {
            return subType;
        }
    }

    /** A governance proposal was executed. */
    record Proposal() implements EventType {
        @Override
        public String toString() {
            return "proposal";
        }
    }
}
