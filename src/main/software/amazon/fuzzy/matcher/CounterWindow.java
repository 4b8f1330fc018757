package software.amazon.fuzzy.matcher;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Arrays;

/**
 * A fixed number of int counters addressed by offset from the front of the window. {@link #shift()} drops the
 * front counter and appends a zeroed one at the back in constant time, moving every other counter one offset
 * closer to the front.
 */
@NotThreadSafe
class CounterWindow {

    private final int[] counters;
    private int head = 0;

    CounterWindow(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.counters = new int[capacity];
    }

    int capacity() {
        return counters.length;
    }

    int get(final int offset) {
        return counters[slot(offset)];
    }

    int increment(final int offset) {
        return ++counters[slot(offset)];
    }

    void shift() {
        counters[head] = 0;
        head = head + 1 == counters.length ? 0 : head + 1;
    }

    void clear() {
        Arrays.fill(counters, 0);
        head = 0;
    }

    private int slot(final int offset) {
        if (offset < 0 || offset >= counters.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside window of " + counters.length);
        }
        final int slot = head + offset;
        return slot < counters.length ? slot : slot - counters.length;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < counters.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(get(i));
        }
        return sb.append(']').toString();
    }
}
