package com.ouc.arq.sdk;

/**
 * Fixed wire layout: seqNum, ackNum and checksum as big-endian 32-bit ints,
 * then the payload. Integrity is not checked here.
 */
public final class PacketCodec {
    public static final int HEADER_LENGTH = 12;
    public static final int PACKET_LENGTH = HEADER_LENGTH + Packet.PAYLOAD_LENGTH;

    private PacketCodec() {}

    public static byte[] encode(Packet packet) {
        byte[] out = new byte[PACKET_LENGTH];
        writeInt(packet.getSeqNum(), out, 0);
        writeInt(packet.getAckNum(), out, 4);
        writeInt(packet.getChecksum(), out, 8);
        System.arraycopy(packet.getPayload(), 0, out, HEADER_LENGTH, Packet.PAYLOAD_LENGTH);
        return out;
    }

    public static Packet decode(byte[] bytes) {
        if (bytes.length != PACKET_LENGTH) {
            throw new IllegalArgumentException("wrong length, expected " + PACKET_LENGTH + " but got " + bytes.length);
        }
        PacketHeader h = new PacketHeader(readInt(bytes, 0), readInt(bytes, 4), readInt(bytes, 8));
        byte[] payload = new byte[Packet.PAYLOAD_LENGTH];
        System.arraycopy(bytes, HEADER_LENGTH, payload, 0, Packet.PAYLOAD_LENGTH);
        return new Packet(h, payload);
    }

    private static void writeInt(int value, byte[] array, int pos) {
        array[pos] = (byte) ((value >>> 24) & 0xFF);
        array[pos + 1] = (byte) ((value >>> 16) & 0xFF);
        array[pos + 2] = (byte) ((value >>> 8) & 0xFF);
        array[pos + 3] = (byte) (value & 0xFF);
    }

    private static int readInt(byte[] bytes, int pos) {
        return ((bytes[pos] & 0xFF) << 24)
                | ((bytes[pos + 1] & 0xFF) << 16)
                | ((bytes[pos + 2] & 0xFF) << 8)
                | (bytes[pos + 3] & 0xFF);
    }
}
