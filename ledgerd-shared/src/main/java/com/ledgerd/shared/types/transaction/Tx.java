package com.ledgerd.shared.types.transaction;

import com.ledgerd.shared.types.hash.Hash;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable transaction: a header plus its code and data sections.
 */
public final class Tx {

    private final Header header;
    private final byte[] code;
    private final byte[] data;

    public Tx(Header header, byte[] code, byte[] data) {
        this.header = Objects.requireNonNull(header, "Header cannot be null");
        this.code = Objects.requireNonNull(code, "Code cannot be null").clone();
        this.data = Objects.requireNonNull(data, "Data cannot be null").clone();
    }

    /**
     * Creates a raw transaction as a client would submit it.
     */
    public static Tx newRaw(String chainId, byte[] code, byte[] data, Instant timestamp) {
        Header header = new Header(
                chainId,
                null,
                timestamp,
                Hash.sha256(code),
                Hash.sha256(data),
                RawHeader.DEFAULT);
        return new Tx(header, code, data);
    }

    public Header header() {
        return header;
    }

    public TxType txType() {
        return header.txType();
    }

    public byte[] code() {
        return code.clone();
    }

    public byte[] data() {
        return data.clone();
    }

    public Hash headerHash() {
        return header.hash();
    }

    /**
     * Returns a copy of this transaction whose header carries the given type.
     * Code, data and every other header field are kept.
     */
    public Tx updateHeader(TxType txType) {
        Objects.requireNonNull(txType, "Tx type cannot be null");
        return new Tx(header.withTxType(txType), code, data);
    }

    /**
     * Wraps a raw transaction for inclusion in a block. The wrapper records the
     * raw header hash so the transaction stays identifiable after decryption.
     */
    public Tx wrap(Fee fee, String pk, long epoch, long gasLimit) {
        if (txType().tag() != TxType.Tag.RAW) {
            throw new IllegalStateException("Only raw transactions can be wrapped, got " + txType().tag());
        }
        return updateHeader(new WrapperTx(fee, pk, epoch, gasLimit, headerHash()));
    }

    /**
     * Turns a wrapper transaction into the decrypted transaction executed at finalization.
     */
    public Tx decrypt(DecryptedTx.Outcome outcome) {
        if (txType().tag() != TxType.Tag.WRAPPER) {
            throw new IllegalStateException("Only wrapper transactions can be decrypted, got " + txType().tag());
        }
        return updateHeader(new DecryptedTx(outcome));
    }

    @Override
    public String toString() {
        return "Tx{type=" + txType().tag() + ", hash=" + headerHash() + "}";
    }
}
