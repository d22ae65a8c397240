package com.ledgerd.shared.types.transaction;

/**
 * The type of a transaction, carried in its header.
 * A transaction is submitted raw, travels through the mempool as a wrapper,
 * and is executed as a decrypted transaction. Protocol transactions are
 * injected by validators and never wrapped.
 */
public sealed interface TxType permits RawHeader, WrapperTx, DecryptedTx, ProtocolTx {

    /**
     * Discriminant of the transaction type.
     */
    enum Tag {
        RAW(0),
        WRAPPER(1),
        DECRYPTED(2),
        PROTOCOL(3);

        private final int code;

        Tag(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    Tag tag();

    /**
     * Appends this type's canonical encoding, tag byte first.
     */
    void writeTo(CanonicalBytes out);
}
