package software.amazon.fuzzy.matcher;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class CounterWindowTest {

    @Test(expected = IllegalArgumentException.class)
    public void testConstructorDisallowsEmptyWindow() {
        new CounterWindow(0);
    }

    @Test
    public void testIncrementAndGet() {
        CounterWindow window = new CounterWindow(3);
        assertEquals(1, window.increment(2));
        assertEquals(2, window.increment(2));
        assertEquals(0, window.get(0));
        assertEquals(2, window.get(2));
        assertEquals("[0, 0, 2]", window.toString());
    }

    @Test
    public void testShiftMovesCountersTowardsTheFront() {
        CounterWindow window = new CounterWindow(3);
        window.increment(0);
        window.increment(1);
        window.increment(2);
        window.increment(2);

        window.shift();
        assertEquals("[1, 2, 0]", window.toString());
        window.shift();
        assertEquals("[2, 0, 0]", window.toString());
        window.increment(2);
        window.shift();
        assertEquals("[0, 1, 0]", window.toString());
        window.shift();
        window.shift();
        assertEquals("[0, 0, 0]", window.toString());
    }

    @Test
    public void testClear() {
        CounterWindow window = new CounterWindow(2);
        window.increment(1);
        window.shift();
        window.increment(1);
        window.clear();
        assertEquals("[0, 0]", window.toString());
        assertEquals(2, window.capacity());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testOffsetOutsideWindow() {
        new CounterWindow(2).increment(2);
    }

    @Test
    public void testSingleCounterWindow() {
        CounterWindow window = new CounterWindow(1);
        window.increment(0);
        window.shift();
        assertEquals(0, window.get(0));
    }
}
