package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class AutomatonBuilderTest {

    private static IntList scan(Automaton automaton, String text) {
        IntList ids = new IntArrayList();
        NodeReference state = automaton.root();
        for (char c : text.toCharArray()) {
            state = state.next(c);
            state.generateMatches(ids::add);
        }
        return ids;
    }

    @Test
    public void testEmptyBuilderBuildsLoneRoot() {
        Automaton automaton = new AutomatonBuilder().build();
        assertEquals(1, automaton.size());
        assertTrue(automaton.root().next('a').isRoot());
        assertTrue(scan(automaton, "abc").isEmpty());
    }

    @Test
    public void testInsertionOrderDoesNotMatter() {
        Automaton forward = new AutomatonBuilder().add("abc", 1).add("bc", 2).add("c", 3).build();
        Automaton backward = new AutomatonBuilder().add("c", 3).add("bc", 2).add("abc", 1).build();

        assertEquals(forward.size(), backward.size());
        assertEquals(IntList.of(1, 2, 3), scan(forward, "abc"));
        assertEquals(scan(forward, "xabcbcc"), scan(backward, "xabcbcc"));
    }

    @Test
    public void testEachBuildIsIndependent() {
        AutomatonBuilder builder = new AutomatonBuilder().add("ab", 0);
        Automaton first = builder.build();
        builder.add("b", 1);
        Automaton second = builder.build();

        assertNotSame(first, second);
        assertEquals(IntList.of(0), scan(first, "ab"));
        assertEquals(IntList.of(0, 1), scan(second, "ab"));
    }

    @Test(expected = NullPointerException.class)
    public void testNullWord() {
        new AutomatonBuilder().add(null, 0);
    }
}
