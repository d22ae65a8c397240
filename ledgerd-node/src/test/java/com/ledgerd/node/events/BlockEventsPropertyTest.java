package com.ledgerd.node.events;

import com.ledgerd.shared.abci.AbciEvent;
import com.ledgerd.shared.abci.AbciEventAttribute;
import com.ledgerd.shared.types.ibc.IbcEvent;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for per-block event collection.
 */
class BlockEventsPropertyTest {

    private final BlockEventEmitter emitter = new BlockEventEmitter(new LedgerEventsConfig());

    @Provide
    Arbitrary<List<String>> ibcTypes() {
        return Arbitraries.strings().alpha().withChars('_').ofMinLength(1).ofMaxLength(20)
                .list().ofMaxSize(30);
    }

    /**
     * Property: A block's events come out in the order they were emitted,
     * each with every attribute indexed.
     */
    @Property(tries = 50)
    void events_keepEmissionOrder(
            @ForAll("ibcTypes") List<String> types,
            @ForAll @LongRange(min = 0, max = 10_000_000) long height) {

        // Given
        BlockEvents block = emitter.beginBlock(height);
        for (int i = 0; i < types.size(); i++) {
            block.onIbc(new IbcEvent(types.get(i), Map.of("seq", Integer.toString(i))));
        }

        // When
        List<AbciEvent> events = block.finish();

        // Then
        assertThat(events).extracting(AbciEvent::type).containsExactlyElementsOf(types);
        for (int i = 0; i < events.size(); i++) {
            assertThat(events.get(i).attributes())
                    .containsExactly(AbciEventAttribute.indexed("seq", Integer.toString(i)));
        }
    }
}
