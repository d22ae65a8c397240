package com.ledgerd.shared.ledger.events;

import com.ledgerd.shared.abci.AbciEvent;
import com.ledgerd.shared.abci.AbciEventAttribute;
import com.ledgerd.shared.ledger.governance.ProposalEvent;
import com.ledgerd.shared.types.ibc.IbcEvent;
import com.ledgerd.shared.types.transaction.RawHeader;
import com.ledgerd.shared.types.transaction.Tx;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Custom event that can be queried from the consensus engine by a
 * websocket subscriber.
 * <p>
 * An event is built by the code path that observes its effect, filled with
 * attributes, then converted with {@link #toAbci()} and handed to the
 * consensus engine. Not thread-safe; never shared while being built.
 */
public final class Event {

    public static final String HASH = "hash";
    public static final String HEIGHT = "height";
    public static final String LOG = "log";

    private final EventType type;
    private final EventLevel level;
    private final Map<String, String> attributes;

    public Event(EventType type, EventLevel level) {
        this(type, level, Map.of());
    }

    public Event(EventType type, EventLevel level, Map<String, String> attributes) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.level = Objects.requireNonNull(level, "Event level cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
        // Map.copyOf rejects null keys and values
        this.attributes = new HashMap<>(Map.copyOf(attributes));
    }

    /**
     * Creates a new event with the hash and height of the transaction
     * already filled in.
     * <ul>
     *   <li>wrapper: {@code accepted}, hashed by its header hash</li>
     *   <li>decrypted: {@code applied}, hashed by the header hash it had as a raw
     *       transaction, so it matches the hash the client submitted</li>
     *   <li>protocol: {@code applied}, hashed by its header hash</li>
     * </ul>
     *
     * @throws IllegalStateException if the transaction is raw, which never reaches finalization
     */
    public static Event newTxEvent(Tx tx, long height) {
        Objects.requireNonNull(tx, "Tx cannot be null");
        if (height < 0) {
            throw new IllegalArgumentException("Block height cannot be negative: " + height);
        }
        Event event = switch (tx.txType().tag()) {
            case WRAPPER -> {
                Event accepted = new Event(EventType.ACCEPTED, EventLevel.TX);
                accepted.set(HASH, tx.headerHash().toString());
                yield accepted;
            }
            case DECRYPTED -> {
                Event applied = new Event(EventType.APPLIED, EventLevel.TX);
                applied.set(HASH, tx.updateHeader(RawHeader.DEFAULT).headerHash().toString());
                yield applied;
            }
            case PROTOCOL -> {
                Event applied = new Event(EventType.APPLIED, EventLevel.TX);
                applied.set(HASH, tx.headerHash().toString());
                yield applied;
            }
            case RAW -> throw new IllegalStateException(
                    "Raw transactions do not emit events: " + tx.headerHash());
        };
        event.set(HEIGHT, Long.toString(height));
        event.set(LOG, "");
        return event;
    }

    /**
     * Converts an IBC effect. The IBC event type becomes the event type.
     */
    public static Event fromIbc(IbcEvent ibcEvent) {
        Objects.requireNonNull(ibcEvent, "IBC event cannot be null");
        return new Event(EventType.ibc(ibcEvent.eventType()), EventLevel.TX, ibcEvent.attributes());
    }

    /**
     * Converts a proposal execution effect into a block-level event.
     */
    public static Event fromProposal(ProposalEvent proposalEvent) {
        Objects.requireNonNull(proposalEvent, "Proposal event cannot be null");
        return new Event(EventType.PROPOSAL, EventLevel.BLOCK, proposalEvent.attributes());
    }

    public EventType type() {
        return type;
    }

    public EventLevel level() {
        return level;
    }

    /**
     * Returns a read-only view of the attributes.
     */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Sets an attribute, inserting the key if it is absent.
     */
    public Event set(String key, String value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        attributes.put(key, value);
        return this;
    }

    /**
     * Gets the value of an attribute, inserting an empty value first if the key is absent.
     */
    public String attribute(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return attributes.computeIfAbsent(key, k -> "");
    }

    /**
     * Gets the value of an attribute that is known to be present.
     *
     * @throws NoSuchElementException if the key is absent
     */
    public String getRequired(String key) {
        String value = attributes.get(key);
        if (value == null) {
            throw new NoSuchElementException("Event " + type + " has no attribute " + key);
        }
        return value;
    }

    /**
     * Get the value corresponding to a given key, if it exists.
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public boolean containsKey(String key) {
        return attributes.containsKey(key);
    }

    /**
     * Converts into the consensus engine's event. Every attribute is indexed;
     * attributes are ordered by key.
     */
    public AbciEvent toAbci() {
        List<AbciEventAttribute> abciAttributes = new TreeMap<>(attributes).entrySet().stream()
                .map(e -> AbciEventAttribute.indexed(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
        return new AbciEvent(type.toString(), abciAttributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event other)) return false;
        return type.equals(other.type) && level == other.level && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, level, attributes);
    }

    @Override
    public String toString() {
        return "Event{type=" + type + ", level=" + level + ", attributes=" + attributes + "}";
    }
}
