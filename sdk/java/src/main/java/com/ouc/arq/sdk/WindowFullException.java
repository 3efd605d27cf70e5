package com.ouc.arq.sdk;

/**
 * Thrown when the sender has no free slot for a new message. The message was not
 * sent or queued; the caller may retry once acknowledgements have moved the window.
 */
public class WindowFullException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int rejectedSeqNum;
    private final int windowBase;

    public WindowFullException(int rejectedSeqNum, int windowBase) {
        super("send window is full: next seq " + rejectedSeqNum + ", window base " + windowBase);
        this.rejectedSeqNum = rejectedSeqNum;
        this.windowBase = windowBase;
    }

    public int getRejectedSeqNum() {
        return rejectedSeqNum;
    }

    public int getWindowBase() {
        return windowBase;
    }
}
