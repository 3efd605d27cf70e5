package com.ouc.arq.sr;

import com.ouc.arq.sdk.Metric;
import com.ouc.arq.sdk.Packet;
import com.ouc.arq.sdk.ProtocolConfig;
import com.ouc.arq.sdk.Statistics;
import com.ouc.arq.sdk.SystemContext;
import com.ouc.arq.sdk.TransportProtocol;
import com.ouc.arq.sdk.WindowFullException;
import com.ouc.arq.sdk.util.Checksum;
import com.ouc.arq.sdk.util.SequenceSpace;

/**
 * Selective Repeat sender (entity A).
 * <p>
 * Every packet in the window is acknowledged individually. The window base only
 * moves over a contiguous run of acknowledged packets, and one timer is kept
 * bound to the base: on expiry only the base packet is resent.
 */
public final class SrSender implements TransportProtocol {
    public static final int TIMER_ID = 0;

    private final ProtocolConfig config;
    private final SequenceSpace space;
    private final WindowRing<SendSlot> window;
    private final RetransmissionTimer timer;
    private final Statistics stats = new Statistics();

    private int nextSeqNum;
    /** Sent but not yet acknowledged. */
    private int outstanding;

    public SrSender() {
        this(ProtocolConfig.defaults());
    }

    public SrSender(ProtocolConfig config) {
        this.config = config;
        this.space = new SequenceSpace(config.getSeqSpace());
        this.window = new WindowRing<>(space, config.getWindowSize());
        this.timer = new RetransmissionTimer(TIMER_ID, config.getTimeout());
    }

    @Override
    public void init(SystemContext ctx) {
        nextSeqNum = 0;
        outstanding = 0;
        window.clear(0);
        timer.reset();
        stats.reset();
        ctx.log("[Sender] SR sender ready, " + config);
    }

    public boolean canAccept() {
        return window.contains(nextSeqNum);
    }

    /**
     * @throws WindowFullException if the window has no free slot; nothing is sent.
     */
    @Override
    public void onAppData(SystemContext ctx, byte[] data) {
        if (!canAccept()) {
            ctx.log("[Sender] New message arrives, send window is full");
            stats.increment(ctx, Metric.WINDOW_FULL);
            throw new WindowFullException(nextSeqNum, window.base());
        }

        Packet packet = Packet.createData(nextSeqNum, data);
        boolean wasEmpty = getWindowCount() == 0;
        window.set(window.offsetOf(nextSeqNum), new SendSlot(packet));
        outstanding++;

        ctx.log("[Sender] Sending packet " + nextSeqNum);
        ctx.sendPacket(packet);
        stats.increment(ctx, Metric.PACKETS_SENT);

        if (wasEmpty) {
            timer.arm(ctx);
        }
        nextSeqNum = space.next(nextSeqNum);
    }

    @Override
    public void onPacket(SystemContext ctx, Packet packet) {
        if (Checksum.isCorrupted(packet)) {
            ctx.log("[Sender] Corrupted ACK received, do nothing");
            stats.increment(ctx, Metric.CORRUPTED_RECEIVED);
            return;
        }

        int ackNum = packet.getAckNum();
        ctx.log("[Sender] Uncorrupted ACK " + ackNum + " received");
        stats.increment(ctx, Metric.ACKS_RECEIVED);

        // Only sequence numbers actually sent and still held can be acknowledged.
        if (!window.contains(ackNum) || window.offsetOf(ackNum) >= getWindowCount()) {
            ctx.log("[Sender] ACK " + ackNum + " outside window [" + window.base() + ", " + nextSeqNum + "), ignored");
            return;
        }

        int offset = window.offsetOf(ackNum);
        SendSlot slot = window.get(offset);
        if (slot.acknowledged) {
            ctx.log("[Sender] Duplicate ACK " + ackNum + ", do nothing");
            stats.increment(ctx, Metric.DUPLICATE_ACKS);
            return;
        }

        slot.acknowledged = true;
        outstanding--;
        stats.increment(ctx, Metric.NEW_ACKS);

        if (offset != 0) {
            ctx.log("[Sender] ACK " + ackNum + " buffered, waiting for base " + window.base());
            return;
        }

        int run = window.leadingRun(s -> s.acknowledged);
        window.slide(run);
        ctx.log("[Sender] Window slides by " + run + " to base " + window.base());

        timer.disarm(ctx);
        if (getWindowCount() > 0) {
            timer.arm(ctx);
        }
    }

    @Override
    public void onTimer(SystemContext ctx, int timerId) {
        if (timerId != timer.timerId()) {
            ctx.log("[Sender] Ignoring unknown timer " + timerId);
            return;
        }
        timer.expired();
        if (getWindowCount() == 0) {
            ctx.log("[Sender] Timeout with empty window, nothing to resend");
            return;
        }

        Packet base = window.get(0).packet;
        ctx.log("[Sender] Timeout, resending packet " + base.getSeqNum());
        ctx.sendPacket(base);
        stats.increment(ctx, Metric.PACKETS_RESENT);
        timer.arm(ctx);
    }

    public int getWindowBase() {
        return window.base();
    }

    public int getNextSeqNum() {
        return nextSeqNum;
    }

    /** Slots held between the base and the next sequence number, acknowledged or not. */
    public int getWindowCount() {
        return space.distance(window.base(), nextSeqNum);
    }

    public int getOutstandingCount() {
        return outstanding;
    }

    public boolean isAcknowledged(int seqNum) {
        if (!window.contains(seqNum) || window.offsetOf(seqNum) >= getWindowCount()) {
            return false;
        }
        return window.get(window.offsetOf(seqNum)).acknowledged;
    }

    public boolean isTimerArmed() {
        return timer.isArmed();
    }

    public Statistics getStatistics() {
        return stats;
    }

    private static final class SendSlot {
        final Packet packet;
        boolean acknowledged;

        SendSlot(Packet packet) {
            this.packet = packet;
        }
    }
}
