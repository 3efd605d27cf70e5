package com.ouc.arq.sdk.util;

/**
 * Modular arithmetic over the circular sequence space {@code [0, size)}.
 * Both engines go through this class so wrap-around is handled in one place.
 */
public final class SequenceSpace {
    private final int size;

    public SequenceSpace(int size) {
        if (size < 2) {
            throw new IllegalArgumentException("sequence space must hold at least 2 numbers, got " + size);
        }
        this.size = size;
    }

    public int size() {
        return size;
    }

    public boolean contains(int seq) {
        return seq >= 0 && seq < size;
    }

    public int add(int seq, int n) {
        return Math.floorMod(seq + n, size);
    }

    public int next(int seq) {
        return add(seq, 1);
    }

    /** Number of steps forward from {@code from} to reach {@code to}. */
    public int distance(int from, int to) {
        return Math.floorMod(to - from, size);
    }

    /**
     * True iff {@code seq} lies in {@code [base, base + width)} modulo the space.
     * Values outside the space are never in a window.
     */
    public boolean inWindow(int base, int width, int seq) {
        return contains(seq) && distance(base, seq) < width;
    }
}
