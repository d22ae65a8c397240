package com.ledgerd.shared.types.ibc;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An effect of IBC message handling, as reported by the IBC module.
 *
 * @param eventType  the IBC event type, e.g. {@code send_packet}
 * @param attributes the event's attributes, keyed by their IBC names
 */
public record IbcEvent(String eventType, Map<String, String> attributes) {

    public IbcEvent {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static IbcEvent sendPacket(Packet packet) {
        return packetEvent("send_packet", packet);
    }

    public static IbcEvent receivePacket(Packet packet) {
        return packetEvent("recv_packet", packet);
    }

    public static IbcEvent writeAcknowledgement(Packet packet, String acknowledgement) {
        Objects.requireNonNull(acknowledgement, "Acknowledgement cannot be null");
        Map<String, String> attributes = packet.toAttributes();
        attributes.put("packet_ack", acknowledgement);
        return new IbcEvent("write_acknowledgement", attributes);
    }

    public static IbcEvent acknowledgePacket(Packet packet) {
        return packetEvent("acknowledge_packet", packet);
    }

    public static IbcEvent timeoutPacket(Packet packet) {
        return packetEvent("timeout_packet", packet);
    }

    private static IbcEvent packetEvent(String type, Packet packet) {
        Objects.requireNonNull(packet, "Packet cannot be null");
        return new IbcEvent(type, packet.toAttributes());
    }

    /**
     * An IBC packet, reduced to the fields that appear in packet events.
     */
    public record Packet(
            long sequence,
            String sourcePort,
            String sourceChannel,
            String destinationPort,
            String destinationChannel,
            String data,
            String timeoutHeight,
            long timeoutTimestamp
    ) {
        public Packet {
            Objects.requireNonNull(sourcePort, "Source port cannot be null");
            Objects.requireNonNull(sourceChannel, "Source channel cannot be null");
            Objects.requireNonNull(destinationPort, "Destination port cannot be null");
            Objects.requireNonNull(destinationChannel, "Destination channel cannot be null");
            data = data != null ? data : "";
            timeoutHeight = timeoutHeight != null ? timeoutHeight : "0-0";
        }

        Map<String, String> toAttributes() {
            Map<String, String> attributes = new HashMap<>();
            attributes.put("packet_sequence", Long.toString(sequence));
            attributes.put("packet_src_port", sourcePort);
            attributes.put("packet_src_channel", sourceChannel);
            attributes.put("packet_dst_port", destinationPort);
            attributes.put("packet_dst_channel", destinationChannel);
            attributes.put("packet_data", data);
            attributes.put("packet_timeout_height", timeoutHeight);
            attributes.put("packet_timeout_timestamp", Long.toString(timeoutTimestamp));
            return attributes;
        }
    }
}
