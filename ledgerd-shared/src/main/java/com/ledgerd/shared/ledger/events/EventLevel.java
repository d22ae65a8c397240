package com.ledgerd.shared.ledger.events;

/**
 * Indicates whether an event is emitted due to an individual transaction
 * or to the nature of a finalized block.
 */
public enum EventLevel {
    /** The event is to do with a finalized block. */
    BLOCK,
    /** The event is to do with an individual transaction. */
    TX
}
