package com.ouc.arq.sr;

import com.ouc.arq.sdk.util.SequenceSpace;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-size circular buffer addressed by sequence number. Offset 0 always holds
 * the window base; sliding advances the base and recycles the freed slots.
 */
final class WindowRing<T> {
    private final SequenceSpace space;
    private final Object[] slots;
    private int head;
    private int base;

    WindowRing(SequenceSpace space, int capacity) {
        this.space = space;
        this.slots = new Object[capacity];
    }

    int base() {
        return base;
    }

    int capacity() {
        return slots.length;
    }

    boolean contains(int seq) {
        return space.inWindow(base, slots.length, seq);
    }

    int offsetOf(int seq) {
        return space.distance(base, seq);
    }

    @SuppressWarnings("unchecked")
    T get(int offset) {
        return (T) slots[physical(offset)];
    }

    void set(int offset, T value) {
        slots[physical(offset)] = value;
    }

    /** Length of the run of non-empty slots from the base that all satisfy {@code test}. */
    int leadingRun(Predicate<? super T> test) {
        int run = 0;
        while (run < slots.length) {
            T slot = get(run);
            if (slot == null || !test.test(slot)) {
                break;
            }
            run++;
        }
        return run;
    }

    /** Retires the first {@code n} slots, returning them in sequence order. */
    List<T> slide(int n) {
        if (n < 0 || n > slots.length) {
            throw new IllegalArgumentException("cannot slide by " + n);
        }
        List<T> retired = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            retired.add(get(0));
            slots[head] = null;
            head = (head + 1) % slots.length;
        }
        base = space.add(base, n);
        return retired;
    }

    void clear(int newBase) {
        for (int i = 0; i < slots.length; i++) {
            slots[i] = null;
        }
        head = 0;
        base = newBase;
    }

    private int physical(int offset) {
        if (offset < 0 || offset >= slots.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside window of " + slots.length);
        }
        return (head + offset) % slots.length;
    }
}
