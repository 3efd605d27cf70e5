package com.ouc.arq.sdk;

import com.ouc.arq.sdk.util.Checksum;

import java.util.Arrays;

public final class Packet {
    public static final int PAYLOAD_LENGTH = 20;

    private static final byte ACK_FILL = '0';

    private final PacketHeader header;
    private final byte[] payload;

    public Packet(PacketHeader header, byte[] payload) {
        if (payload.length != PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                    "payload must be " + PAYLOAD_LENGTH + " bytes, got " + payload.length);
        }
        this.header = header.copy();
        this.payload = payload.clone();
    }

    /** Builds a checksummed data packet; the ack field is left unused. */
    public static Packet createData(int seqNum, byte[] payload) {
        PacketHeader h = new PacketHeader();
        h.setSeqNum(seqNum);
        Checksum.attach(h, payload);
        return new Packet(h, payload);
    }

    /** Builds a checksummed ACK for {@code ackNum}; the receiver has no data to carry. */
    public static Packet createAck(int ackNum) {
        byte[] fill = new byte[PAYLOAD_LENGTH];
        Arrays.fill(fill, ACK_FILL);
        PacketHeader h = new PacketHeader();
        h.setAckNum(ackNum);
        Checksum.attach(h, fill);
        return new Packet(h, fill);
    }

    public PacketHeader getHeader() {
        return header.copy();
    }

    public int getSeqNum() {
        return header.getSeqNum();
    }

    public int getAckNum() {
        return header.getAckNum();
    }

    public int getChecksum() {
        return header.getChecksum();
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    @Override
    public String toString() {
        return "Packet[" + header + "]";
    }
}
