package com.ledgerd.shared.ledger.events;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Borsh encoding of events, the binary form the node stores and exchanges them in.
 * <ul>
 *   <li>event type: one variant byte ({@code accepted}=0, {@code applied}=1,
 *       IBC=2 followed by its sub-type string, {@code proposal}=3)</li>
 *   <li>level: one variant byte (block=0, tx=1)</li>
 *   <li>attributes: u32 count, then key/value strings ordered by the key's UTF-8 bytes</li>
 * </ul>
 * Integers are little-endian; strings are a u32 byte length followed by UTF-8.
 */
public final class EventEncoding {

    private static final int ACCEPTED = 0;
    private static final int APPLIED = 1;
    private static final int IBC = 2;
    private static final int PROPOSAL = 3;

    private static final int BLOCK = 0;
    private static final int TX = 1;

    private EventEncoding() {}

    public static byte[] encode(Event event) {
        Objects.requireNonNull(event, "Event cannot be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        EventType type = event.type();
        if (type instanceof EventType.Accepted) {
            out.write(ACCEPTED);
        } else if (type instanceof EventType.Applied) {
            out.write(APPLIED);
        } else if (type instanceof EventType.Ibc ibc) {
            out.write(IBC);
            writeString(out, ibc.subType());
        } else if (type instanceof EventType.Proposal) {
            out.write(PROPOSAL);
        } else {
            throw new IllegalStateException("Unknown event type: " + type.getClass().getName());
        }

        out.write(event.level() == EventLevel.BLOCK ? BLOCK : TX);

        List<byte[][]> entries = new ArrayList<>();
        for (Map.Entry<String, String> e : event.attributes().entrySet()) {
            entries.add(new byte[][]{
                    e.getKey().getBytes(StandardCharsets.UTF_8),
                    e.getValue().getBytes(StandardCharsets.UTF_8)});
        }
        entries.sort((a, b) -> Arrays.compareUnsigned(a[0], b[0]));
        writeU32(out, entries.size());
        for (byte[][] entry : entries) {
            writeBytes(out, entry[0]);
            writeBytes(out, entry[1]);
        }
        return out.toByteArray();
    }

    /**
     * Decodes an event, requiring every input byte to be consumed.
     *
     * @throws EventEncodingException if the bytes are not a well-formed event
     */
    public static Event decode(byte[] bytes) throws EventEncodingException {
        Objects.requireNonNull(bytes, "Bytes cannot be null");
        ByteBuffer in = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        try {
            int typeTag = Byte.toUnsignedInt(in.get());
            EventType type = switch (typeTag) {
                case ACCEPTED -> EventType.ACCEPTED;
                case APPLIED -> EventType.APPLIED;
                case IBC -> EventType.ibc(readString(in));
                case PROPOSAL -> EventType.PROPOSAL;
                default -> throw new EventEncodingException("Unknown event type variant: " + typeTag);
            };

            int levelTag = Byte.toUnsignedInt(in.get());
            EventLevel level = switch (levelTag) {
                case BLOCK -> EventLevel.BLOCK;
                case TX -> EventLevel.TX;
                default -> throw new EventEncodingException("Unknown event level variant: " + levelTag);
            };

            long count = readU32(in);
            Map<String, String> attributes = new HashMap<>();
            for (long i = 0; i < count; i++) {
                String key = readString(in);
                String value = readString(in);
                if (attributes.put(key, value) != null) {
                    throw new EventEncodingException("Duplicate attribute key: " + key);
                }
            }

            if (in.hasRemaining()) {
                throw new EventEncodingException(in.remaining() + " trailing bytes after event");
            }
            return new Event(type, level, attributes);
        } catch (BufferUnderflowException e) {
            throw new EventEncodingException("Event bytes end unexpectedly at offset " + in.position(), e);
        }
    }

    private static void writeU32(ByteArrayOutputStream out, int value) {
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 24) & 0xFF);
    }

    private static void writeBytes(ByteArrayOutputStream out, byte[] value) {
        writeU32(out, value.length);
        out.writeBytes(value);
    }

    private static void writeString(ByteArrayOutputStream out, String value) {
        writeBytes(out, value.getBytes(StandardCharsets.UTF_8));
    }

    private static long readU32(ByteBuffer in) {
        return Integer.toUnsignedLong(in.getInt());
    }

    private static String readString(ByteBuffer in) throws EventEncodingException {
        long length = readU32(in);
        if (length > in.remaining()) {
            throw new EventEncodingException(
                    "String of " + length + " bytes exceeds the " + in.remaining() + " remaining");
        }
        byte[] raw = new byte[(int) length];
        in.get(raw);
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new EventEncodingException("String is not valid UTF-8", e);
        }
    }

    /**
     * Error decoding an event from bytes.
     */
    public static class EventEncodingException extends Exception {
        public EventEncodingException(String message) {
            super(message);
        }

        public EventEncodingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
