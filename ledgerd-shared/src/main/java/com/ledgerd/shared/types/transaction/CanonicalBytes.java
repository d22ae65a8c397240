package com.ledgerd.shared.types.transaction;

import com.ledgerd.shared.types.hash.Hash;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Deterministic byte encoding used for header hashing.
 * Variable-length fields are prefixed with their length as a 4-byte big-endian int.
 */
public final class CanonicalBytes {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public CanonicalBytes writeByte(int value) {
        out.write(value & 0xFF);
        return this;
    }

    public CanonicalBytes writeBoolean(boolean value) {
        return writeByte(value ? 1 : 0);
    }

    public CanonicalBytes writeInt(int value) {
        for (int shift = 24; shift >= 0; shift -= 8) {
            out.write((value >>> shift) & 0xFF);
        }
        return this;
    }

    public CanonicalBytes writeLong(long value) {
        for (int shift = 56; shift >= 0; shift -= 8) {
            out.write((int) (value >>> shift) & 0xFF);
        }
        return this;
    }

    public CanonicalBytes writeBytes(byte[] value) {
        writeInt(value.length);
        out.writeBytes(value);
        return this;
    }

    public CanonicalBytes writeString(String value) {
        return writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public CanonicalBytes writeHash(Hash hash) {
        out.writeBytes(hash.toBytes());
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
