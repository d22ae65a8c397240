package com.ledgerd.shared.ledger.events;

import com.ledgerd.shared.abci.AbciEvent;
import com.ledgerd.shared.abci.AbciEventAttribute;
import com.ledgerd.shared.ledger.governance.ProposalEvent;
import com.ledgerd.shared.ledger.governance.TallyResult;
import com.ledgerd.shared.types.ibc.IbcEvent;
import com.ledgerd.shared.types.transaction.DecryptedTx;
import com.ledgerd.shared.types.transaction.Fee;
import com.ledgerd.shared.types.transaction.ProtocolTx;
import com.ledgerd.shared.types.transaction.ProtocolTxKind;
import com.ledgerd.shared.types.transaction.Tx;
import com.ledgerd.shared.types.transaction.WrapperTx;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for building events from transactions and effects, and for the
 * attribute indexing contract.
 */
class EventTest {

    private static final Fee FEE = new Fee(BigInteger.ONE, "nam");

    private final Tx raw = Tx.newRaw("ledgerd-test.0",
            "tx_bond.wasm".getBytes(StandardCharsets.UTF_8),
            "bond 5".getBytes(StandardCharsets.UTF_8),
            Instant.parse("2023-03-01T12:00:00Z"));

    // ==================== Tx Events ====================

    /**
     * Property: A wrapper tx is accepted with its own hash, the height and an empty log.
     */
    @Test
    void newTxEvent_wrapperIsAccepted() {
        // Given
        Tx wrapper = raw.wrap(FEE, "pk-1", 1, 10_000);

        // When
        Event event = Event.newTxEvent(wrapper, 42);

        // Then
        assertThat(event.type()).isEqualTo(EventType.ACCEPTED);
        assertThat(event.level()).isEqualTo(EventLevel.TX);
        assertThat(event.attributes())
                .containsOnly(
                        entry("hash", wrapper.headerHash().toString()),
                        entry("height", "42"),
                        entry("log", ""));
    }

    /**
     * Property: A decrypted tx is applied under the hash the client submitted.
     */
    @Test
    void newTxEvent_decryptedIsAppliedWithRawHash() {
        // Given
        Tx wrapper = raw.wrap(FEE, "pk-1", 1, 10_000);
        Tx decrypted = wrapper.decrypt(DecryptedTx.Outcome.DECRYPTED);

        // When
        Event event = Event.newTxEvent(decrypted, 43);

        // Then
        assertThat(event.type()).isEqualTo(EventType.APPLIED);
        assertThat(event.getRequired("hash"))
                .isEqualTo(((WrapperTx) wrapper.txType()).rawHeaderHash().toString())
                .isEqualTo(raw.headerHash().toString())
                .isNotEqualTo(decrypted.headerHash().toString());
    }

    @Test
    void newTxEvent_undecryptableKeepsHashContinuity() {
        // Given
        Tx undecryptable = raw.wrap(FEE, "pk-1", 1, 10_000).decrypt(DecryptedTx.Outcome.UNDECRYPTABLE);

        // When
        Event event = Event.newTxEvent(undecryptable, 43);

        // Then
        assertThat(event.getRequired("hash")).isEqualTo(raw.headerHash().toString());
    }

    @Test
    void newTxEvent_protocolIsAppliedWithOwnHash() {
        // Given
        Tx protocol = raw.updateHeader(new ProtocolTx("validator-pk", ProtocolTxKind.VALSET_UPDATE_VEXT));

        // When
        Event event = Event.newTxEvent(protocol, 7);

        // Then
        assertThat(event.type()).isEqualTo(EventType.APPLIED);
        assertThat(event.getRequired("hash")).isEqualTo(protocol.headerHash().toString());
    }

    @Test
    void newTxEvent_rawTxFailsFast() {
        // When/Then
        assertThatThrownBy(() -> Event.newTxEvent(raw, 1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void newTxEvent_rejectsNegativeHeight() {
        // Given
        Tx wrapper = raw.wrap(FEE, "pk-1", 1, 10_000);

        // When/Then
        assertThatThrownBy(() -> Event.newTxEvent(wrapper, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Construction ====================

    /**
     * Property: Every attribute of an event has a key and a value.
     */
    @Test
    void constructor_rejectsNullKeysAndValues() {
        // Given
        Map<String, String> nullValue = new HashMap<>();
        nullValue.put("hash", null);
        Map<String, String> nullKey = new HashMap<>();
        nullKey.put(null, "x");

        // When/Then
        assertThatThrownBy(() -> new Event(EventType.APPLIED, EventLevel.TX, nullValue))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Event(EventType.APPLIED, EventLevel.TX, nullKey))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_copiesAttributes() {
        // Given
        Map<String, String> source = new HashMap<>();
        source.put("hash", "AB");

        // When
        Event event = new Event(EventType.APPLIED, EventLevel.TX, source);
        source.put("hash", "CD");

        // Then
        assertThat(event.getRequired("hash")).isEqualTo("AB");
    }

    // ==================== Attribute Access ====================

    /**
     * Property: Reading an absent key through {@code attribute} inserts an empty value.
     */
    @Test
    void attribute_insertsEmptyValueWhenAbsent() {
        // Given
        Event event = new Event(EventType.ACCEPTED, EventLevel.TX);
        assertThat(event.containsKey("log")).isFalse();

        // When
        String value = event.attribute("log");

        // Then
        assertThat(value).isEmpty();
        assertThat(event.containsKey("log")).isTrue();
        assertThat(event.get("log")).contains("");
    }

    @Test
    void attribute_returnsExistingValue() {
        // Given
        Event event = new Event(EventType.ACCEPTED, EventLevel.TX).set("code", "0");

        // When/Then
        assertThat(event.attribute("code")).isEqualTo("0");
    }

    @Test
    void set_overwritesValue() {
        // Given/When
        Event event = new Event(EventType.APPLIED, EventLevel.TX)
                .set("log", "")
                .set("log", "out of gas");

        // Then
        assertThat(event.getRequired("log")).isEqualTo("out of gas");
        assertThat(event.attributes()).hasSize(1);
    }

    @Test
    void getRequired_failsOnAbsentKey() {
        // Given
        Event event = new Event(EventType.APPLIED, EventLevel.TX);

        // When/Then
        assertThatThrownBy(() -> event.getRequired("hash"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("hash");
    }

    @Test
    void get_isEmptyOnAbsentKey() {
        // Given
        Event event = new Event(EventType.APPLIED, EventLevel.TX);

        // When/Then
        assertThat(event.get("hash")).isEmpty();
        assertThat(event.containsKey("hash")).isFalse();
    }

    @Test
    void attributes_viewIsReadOnly() {
        // Given
        Event event = new Event(EventType.APPLIED, EventLevel.TX);

        // When/Then
        assertThatThrownBy(() -> event.attributes().put("hash", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ==================== Conversions ====================

    @Test
    void fromIbc_keepsTypeAndAttributes() {
        // Given
        IbcEvent ibc = new IbcEvent("update_client", Map.of("client_id", "07-tendermint-0", "consensus_height", "1-5"));

        // When
        Event event = Event.fromIbc(ibc);

        // Then
        assertThat(event.type()).isEqualTo(EventType.ibc("update_client"));
        assertThat(event.level()).isEqualTo(EventLevel.TX);
        assertThat(event.attributes()).isEqualTo(ibc.attributes());
    }

    @Test
    void fromProposal_isBlockLevel() {
        // Given
        ProposalEvent proposal = ProposalEvent.of(TallyResult.PASSED, 3, true, true);

        // When
        Event event = Event.fromProposal(proposal);

        // Then
        assertThat(event.type()).isEqualTo(EventType.PROPOSAL);
        assertThat(event.level()).isEqualTo(EventLevel.BLOCK);
        assertThat(event.attributes()).isEqualTo(proposal.attributes());
    }

    /**
     * Property: The wire event indexes every attribute and orders them by key.
     */
    @Test
    void toAbci_indexesEveryAttributeInKeyOrder() {
        // Given
        Event event = new Event(EventType.APPLIED, EventLevel.TX)
                .set("log", "")
                .set("height", "9")
                .set("hash", "AB");

        // When
        AbciEvent abci = event.toAbci();

        // Then
        assertThat(abci.type()).isEqualTo("applied");
        assertThat(abci.attributes()).containsExactly(
                new AbciEventAttribute("hash", "AB", true),
                new AbciEventAttribute("height", "9", true),
                new AbciEventAttribute("log", "", true));
    }

    @Test
    void toAbci_usesIbcSubTypeAsType() {
        // Given
        Event event = Event.fromIbc(new IbcEvent("recv_packet", Map.of()));

        // When
        AbciEvent abci = event.toAbci();

        // Then
        assertThat(abci.type()).isEqualTo("recv_packet");
        assertThat(abci.attributes()).isEmpty();
    }
}
