package com.ouc.arq.sr;

import com.ouc.arq.sdk.SystemContext;

/**
 * The single pending alarm of an entity. Tracks whether the environment currently
 * holds a running timer for it, so the timer is never started twice.
 */
final class RetransmissionTimer {
    private final int timerId;
    private final long interval;
    private boolean armed;

    RetransmissionTimer(int timerId, long interval) {
        this.timerId = timerId;
        this.interval = interval;
    }

    /** Starts a fresh interval, cancelling any running one first. */
    void arm(SystemContext ctx) {
        if (armed) {
            ctx.cancelTimer(timerId);
        }
        ctx.startTimer(interval, timerId);
        armed = true;
    }

    void disarm(SystemContext ctx) {
        if (armed) {
            ctx.cancelTimer(timerId);
            armed = false;
        }
    }

    /** The environment fired the timer; it is no longer running. */
    void expired() {
        armed = false;
    }

    void reset() {
        armed = false;
    }

    boolean isArmed() {
        return armed;
    }

    int timerId() {
        return timerId;
    }
}
