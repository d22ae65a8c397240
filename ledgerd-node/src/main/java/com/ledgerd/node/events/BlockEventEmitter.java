package com.ledgerd.node.events;

import com.ledgerd.shared.abci.AbciEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Builds the events of each finalized block and hands them to the consensus engine.
 */
@Service
public class BlockEventEmitter {

    private static final Logger log = LoggerFactory.getLogger(BlockEventEmitter.class);
    private final LedgerEventsConfig config;

    public BlockEventEmitter(LedgerEventsConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * Starts collecting the events of a block.
     *
     * @param height height of the block being finalized
     * @return a collector owned by the caller for the duration of the block
     */
    public BlockEvents beginBlock(long height) {
        if (height < 0) {
            throw new IllegalArgumentException("Block height cannot be negative: " + height);
        }
        log.debug("Collecting events for block {}", height);
        return new BlockEvents(height, config.isLogEmitted());
    }

    /**
     * Finishes the block and passes its events to the sink.
     *
     * @return the events handed to the sink
     */
    public List<AbciEvent> publish(BlockEvents block, EventSink sink) {
        Objects.requireNonNull(block, "Block events cannot be null");
        Objects.requireNonNull(sink, "Sink cannot be null");
        List<AbciEvent> events = block.finish();
        sink.accept(block.height(), events);
        log.debug("Published {} events for block {}", events.size(), block.height());
        return events;
    }
}
