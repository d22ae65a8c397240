package com.ledgerd.shared.types.transaction;

import java.util.Objects;

/**
 * Header type of a wrapper transaction after its payload was decrypted for execution.
 */
public record DecryptedTx(Outcome outcome) implements TxType {

    /**
     * Result of decryption. The code is part of the header hash.
     */
    public enum Outcome {
        DECRYPTED(0),
        UNDECRYPTABLE(1);

        private final int code;

        Outcome(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    public DecryptedTx {
        Objects.requireNonNull(outcome, "Outcome cannot be null");
    }

    @Override
    public Tag tag() {
        return Tag.DECRYPTED;
    }

    @Override
    public void writeTo(CanonicalBytes out) {
        out.writeByte(Tag.DECRYPTED.code())
                .writeByte(outcome.code());
    }
}
