package com.ledgerd.node.events;

import com.ledgerd.shared.abci.AbciEvent;

import java.util.List;

/**
 * Receives the events of a finalized block, in emission order.
 * Typically the consensus engine's finalize-block response.
 */
@FunctionalInterface
public interface EventSink {

    void accept(long height, List<AbciEvent> events);
}
