package com.ledgerd.node.events;

import com.ledgerd.shared.abci.AbciEvent;
import com.ledgerd.shared.ledger.events.Event;
import com.ledgerd.shared.ledger.governance.ProposalEvent;
import com.ledgerd.shared.types.ibc.IbcEvent;
import com.ledgerd.shared.types.transaction.Tx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Events emitted while finalizing one block, in emission order.
 * Owned by the finalization code path of that block; not thread-safe.
 */
public class BlockEvents {

    private static final Logger log = LoggerFactory.getLogger(BlockEvents.class);

    private final long height;
    private final boolean logEmitted;
    private final List<AbciEvent> events = new ArrayList<>();
    private boolean finished;

    BlockEvents(long height, boolean logEmitted) {
        this.height = height;
        this.logEmitted = logEmitted;
    }

    public long height() {
        return height;
    }

    public int size() {
        return events.size();
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Emits the accepted or applied event of a transaction at this block's height.
     */
    public Event onTx(Tx tx) {
        return add(Event.newTxEvent(tx, height));
    }

    public Event onIbc(IbcEvent ibcEvent) {
        return add(Event.fromIbc(ibcEvent));
    }

    public Event onProposal(ProposalEvent proposalEvent) {
        return add(Event.fromProposal(proposalEvent));
    }

    /**
     * Emits an event built by the caller.
     *
     * @return the event, for callers that keep a handle for logging
     */
    public Event add(Event event) {
        Objects.requireNonNull(event, "Event cannot be null");
        checkOpen();
        events.add(event.toAbci());
        if (logEmitted) {
            log.info("Block {} emitted {} event at level {}: {}",
                    height, event.type(), event.level(), event.attributes());
        }
        return event;
    }

    /**
     * Closes the block and returns its events. No event can be added afterwards.
     */
    public List<AbciEvent> finish() {
        checkOpen();
        finished = true;
        return List.copyOf(events);
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Events of block " + height + " were already finished");
        }
    }
}
