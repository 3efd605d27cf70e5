package com.ouc.arq.sdk;

public final class PacketHeader {
    /** Fills header fields that carry no meaning for the packet's role. */
    public static final int NOT_IN_USE = -1;

    private int seqNum = NOT_IN_USE;
    private int ackNum = NOT_IN_USE;
    private int checksum;

    public PacketHeader() {}

    public PacketHeader(int seqNum, int ackNum, int checksum) {
        this.seqNum = seqNum;
        this.ackNum = ackNum;
        this.checksum = checksum;
    }

    public int getSeqNum() {
        return seqNum;
    }

    public void setSeqNum(int seqNum) {
        this.seqNum = seqNum;
    }

    public int getAckNum() {
        return ackNum;
    }

    public void setAckNum(int ackNum) {
        this.ackNum = ackNum;
    }

    public int getChecksum() {
        return checksum;
    }

    public void setChecksum(int checksum) {
        this.checksum = checksum;
    }

    public boolean isAck() {
        return ackNum != NOT_IN_USE;
    }

    public PacketHeader copy() {
        return new PacketHeader(seqNum, ackNum, checksum);
    }

    @Override
    public String toString() {
        return "seq=" + seqNum + ", ack=" + ackNum + ", checksum=" + checksum;
    }
}
