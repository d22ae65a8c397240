package com.ledgerd.shared.types.transaction;

/**
 * Header type of a transaction that has not been wrapped.
 */
public record RawHeader() implements TxType {

    public static final RawHeader DEFAULT = new RawHeader();

    @Override
    public Tag tag() {
        return Tag.RAW;
    }

    @Override
    public void writeTo(CanonicalBytes out) {
        out.writeByte(Tag.RAW.code());
    }
}
