package com.ledgerd.shared.types.hash;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A 32-byte SHA-256 digest.
 * Rendered as upper-case hex, which is the form transaction hashes take
 * in event attributes and RPC responses.
 */
public final class Hash {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final byte[] bytes;

    private Hash(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Hashes the given bytes with SHA-256.
     */
    public static Hash sha256(byte[] data) {
        Objects.requireNonNull(data, "Data cannot be null");
        return new Hash(org.web3j.crypto.Hash.sha256(data));
    }

    /**
     * Wraps an existing 32-byte digest.
     */
    public static Hash of(byte[] digest) {
        Objects.requireNonNull(digest, "Digest cannot be null");
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Hash must be " + LENGTH + " bytes, got " + digest.length);
        }
        return new Hash(digest.clone());
    }

    /**
     * Parses a hex string, with or without a 0x prefix, in either case.
     */
    public static Hash fromHex(String hex) {
        Objects.requireNonNull(hex, "Hex cannot be null");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Hash hex must be " + LENGTH * 2 + " digits: " + hex);
        }
        return new Hash(HexFormat.of().parseHex(digits));
    }

    public static Hash zero() {
        return new Hash(new byte[LENGTH]);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return HEX.formatHex(bytes);
    }
}
