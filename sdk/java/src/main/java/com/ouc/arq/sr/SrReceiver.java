package com.ouc.arq.sr;

import com.ouc.arq.sdk.Metric;
import com.ouc.arq.sdk.Packet;
import com.ouc.arq.sdk.ProtocolConfig;
import com.ouc.arq.sdk.Statistics;
import com.ouc.arq.sdk.SystemContext;
import com.ouc.arq.sdk.TransportProtocol;
import com.ouc.arq.sdk.util.Checksum;
import com.ouc.arq.sdk.util.SequenceSpace;

import java.util.Objects;

/**
 * Selective Repeat receiver (entity B).
 * <p>
 * Acknowledges every intact packet individually, buffers out-of-order packets
 * inside its window and hands payloads up strictly in sequence order.
 * Transfer is simplex: B never sends data and never runs a timer.
 */
public final class SrReceiver implements TransportProtocol {
    private final ProtocolConfig config;
    private final WindowRing<Packet> window;
    private final Statistics stats = new Statistics();

    public SrReceiver() {
        this(ProtocolConfig.defaults());
    }

    public SrReceiver(ProtocolConfig config) {
        this.config = config;
        this.window = new WindowRing<>(new SequenceSpace(config.getSeqSpace()), config.getWindowSize());
    }

    @Override
    public void init(SystemContext ctx) {
        window.clear(0);
        stats.reset();
        ctx.log("[Receiver] SR receiver ready, " + config);
    }

    @Override
    public void onPacket(SystemContext ctx, Packet packet) {
        // No ACK for a corrupted packet: the sender's timeout recovers it.
        if (Checksum.isCorrupted(packet)) {
            ctx.log("[Receiver] Corrupted packet, dropped");
            stats.increment(ctx, Metric.CORRUPTED_RECEIVED);
            return;
        }

        int seqNum = packet.getSeqNum();
        sendAck(ctx, seqNum);

        if (!window.contains(seqNum)) {
            ctx.log("[Receiver] Packet " + seqNum + " outside window at " + window.base() + ", already delivered");
            stats.increment(ctx, Metric.DUPLICATE_PACKETS);
            return;
        }

        int offset = window.offsetOf(seqNum);
        if (window.get(offset) != null) {
            ctx.log("[Receiver] Packet " + seqNum + " already buffered");
            stats.increment(ctx, Metric.DUPLICATE_PACKETS);
            return;
        }
        window.set(offset, packet);

        if (offset != 0) {
            ctx.log("[Receiver] Packet " + seqNum + " buffered, waiting for " + window.base());
            return;
        }

        for (Packet p : window.slide(window.leadingRun(Objects::nonNull))) {
            ctx.log("[Receiver] Packet " + p.getSeqNum() + " delivered to application");
            ctx.deliverData(p.getPayload());
            stats.increment(ctx, Metric.PACKETS_DELIVERED);
        }
    }

    private void sendAck(SystemContext ctx, int ackNum) {
        ctx.log("[Receiver] Sending ACK " + ackNum);
        ctx.sendPacket(Packet.createAck(ackNum));
        stats.increment(ctx, Metric.ACKS_SENT);
    }

    @Override
    public void onAppData(SystemContext ctx, byte[] data) {
        ctx.log("[Receiver] Simplex transfer, ignoring outbound data of len " + data.length);
    }

    @Override
    public void onTimer(SystemContext ctx, int timerId) {
        ctx.log("[Receiver] Ignores timer " + timerId);
    }

    /** Next sequence number the application is waiting for; also the window base. */
    public int getExpectedSeqNum() {
        return window.base();
    }

    public int getBufferedCount() {
        int count = 0;
        for (int i = 0; i < window.capacity(); i++) {
            if (window.get(i) != null) {
                count++;
            }
        }
        return count;
    }

    public boolean isBuffered(int seqNum) {
        return window.contains(seqNum) && window.get(window.offsetOf(seqNum)) != null;
    }

    public Statistics getStatistics() {
        return stats;
    }
}
