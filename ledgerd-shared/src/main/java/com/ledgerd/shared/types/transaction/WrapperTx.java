package com.ledgerd.shared.types.transaction;

import com.ledgerd.shared.types.hash.Hash;

import java.util.Objects;

/**
 * Header type of a transaction wrapped for inclusion in a block.
 *
 * @param fee            fee paid for inclusion
 * @param pk             public key of the fee payer
 * @param epoch          epoch the wrapper was signed in
 * @param gasLimit       maximum gas the inner transaction may use
 * @param rawHeaderHash  header hash of the inner transaction as it was submitted raw
 */
public record WrapperTx(
        Fee fee,
        String pk,
        long epoch,
        long gasLimit,
        Hash rawHeaderHash
) implements TxType {

    public WrapperTx {
        Objects.requireNonNull(fee, "Fee cannot be null");
        Objects.requireNonNull(pk, "Public key cannot be null");
        Objects.requireNonNull(rawHeaderHash, "Raw header hash cannot be null");
    }

    @Override
    public Tag tag() {
        return Tag.WRAPPER;
    }

    @Override
    public void writeTo(CanonicalBytes out) {
        out.writeByte(Tag.WRAPPER.code())
                .writeBytes(fee.amount().toByteArray())
                .writeString(fee.token())
                .writeString(pk)
                .writeLong(epoch)
                .writeLong(gasLimit)
                .writeHash(rawHeaderHash);
    }
}
