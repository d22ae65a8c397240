package com.ledgerd.shared.types.transaction;

import com.ledgerd.shared.types.hash.Hash;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Transaction header. The header hash identifies a transaction; the code and
 * data sections are committed to through their hashes.
 */
public record Header(
        String chainId,
        Instant expiration,
        Instant timestamp,
        Hash codeHash,
        Hash dataHash,
        TxType txType
) {

    public Header {
        Objects.requireNonNull(chainId, "Chain ID cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(codeHash, "Code hash cannot be null");
        Objects.requireNonNull(dataHash, "Data hash cannot be null");
        Objects.requireNonNull(txType, "Tx type cannot be null");
    }

    public Optional<Instant> expirationTime() {
        return Optional.ofNullable(expiration);
    }

    /**
     * Returns a copy of this header with a different transaction type.
     */
    public Header withTxType(TxType type) {
        return new Header(chainId, expiration, timestamp, codeHash, dataHash, type);
    }

    /**
     * Gets canonical bytes for hashing.
     */
    public byte[] getCanonicalBytes() {
        CanonicalBytes out = new CanonicalBytes()
                .writeString(chainId)
                .writeBoolean(expiration != null);
        if (expiration != null) {
            out.writeLong(expiration.getEpochSecond()).writeInt(expiration.getNano());
        }
        out.writeLong(timestamp.getEpochSecond())
                .writeInt(timestamp.getNano())
                .writeHash(codeHash)
                .writeHash(dataHash);
        txType.writeTo(out);
        return out.toByteArray();
    }

    public Hash hash() {
        return Hash.sha256(getCanonicalBytes());
    }
}
