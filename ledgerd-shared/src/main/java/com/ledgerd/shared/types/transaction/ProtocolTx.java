package com.ledgerd.shared.types.transaction;

import java.util.Objects;

/**
 * Header type of a validator-originated protocol transaction.
 */
public record ProtocolTx(String pk, ProtocolTxKind kind) implements TxType {

    public ProtocolTx {
        Objects.requireNonNull(pk, "Public key cannot be null");
        Objects.requireNonNull(kind, "Protocol tx kind cannot be null");
    }

    @Override
    public Tag tag() {
        return Tag.PROTOCOL;
    }

    @Override
    public void writeTo(CanonicalBytes out) {
        out.writeByte(Tag.PROTOCOL.code())
                .writeString(pk)
                .writeByte(kind.code());
    }
}
