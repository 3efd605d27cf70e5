package com.ouc.arq.sdk.util;

import com.ouc.arq.sdk.Packet;
import com.ouc.arq.sdk.PacketHeader;

/**
 * Additive packet checksum shared by both ends of the link.
 * A detector only: it must differ from the original whenever a header field
 * or a payload byte has been overwritten, but it corrects nothing.
 */
public final class Checksum {
    private Checksum() {}

    public static int compute(int seqNum, int ackNum, byte[] payload) {
        int sum = seqNum;
        sum += ackNum;
        for (byte b : payload) {
            sum += Byte.toUnsignedInt(b);
        }
        return sum;
    }

    public static int of(Packet packet) {
        return compute(packet.getSeqNum(), packet.getAckNum(), packet.getPayload());
    }

    public static boolean isCorrupted(Packet packet) {
        return packet.getChecksum() != of(packet);
    }

    public static void attach(PacketHeader header, byte[] payload) {
        header.setChecksum(compute(header.getSeqNum(), header.getAckNum(), payload));
    }
}
