package software.amazon.fuzzy.matcher;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static software.amazon.fuzzy.matcher.Automaton.NO_LINK;
import static software.amazon.fuzzy.matcher.Automaton.ROOT;

/**
 * Uses the classic he/she/his/hers dictionary, scanned over "ushers".
 */
public class AutomatonTest {

    private static final int HE = 0;
    private static final int SHE = 1;
    private static final int HIS = 2;
    private static final int HERS = 3;

    private Automaton automaton;

    @Before
    public void setup() {
        automaton = new AutomatonBuilder()
                .add("he", HE)
                .add("she", SHE)
                .add("his", HIS)
                .add("hers", HERS)
                .build();
    }

    static int walk(Automaton automaton, String path) {
        int node = ROOT;
        for (char c : path.toCharArray()) {
            node = automaton.trieTransition(node, c);
            if (node == NO_LINK) {
                return NO_LINK;
            }
        }
        return node;
    }

    @Test
    public void testTrieSharesPrefixes() {
        // root, h, he, her, hers, hi, his, s, sh, she
        assertEquals(10, automaton.size());
        assertEquals(walk(automaton, "he"), automaton.trieTransition(walk(automaton, "h"), 'e'));
        assertEquals(NO_LINK, walk(automaton, "hex"));
    }

    @Test
    public void testTerminatedIds() {
        assertEquals(HE, automaton.node(walk(automaton, "he")).getTerminatedIds().getInt(0));
        assertEquals(HERS, automaton.node(walk(automaton, "hers")).getTerminatedIds().getInt(0));
        assertFalse(automaton.node(walk(automaton, "her")).isTerminal());
        assertFalse(automaton.node(ROOT).isTerminal());
    }

    @Test
    public void testSuffixLinks() {
        assertEquals(ROOT, automaton.node(ROOT).getSuffixLink());
        assertEquals(ROOT, automaton.node(walk(automaton, "h")).getSuffixLink());
        assertEquals(ROOT, automaton.node(walk(automaton, "he")).getSuffixLink());
        assertEquals(walk(automaton, "h"), automaton.node(walk(automaton, "sh")).getSuffixLink());
        assertEquals(walk(automaton, "he"), automaton.node(walk(automaton, "she")).getSuffixLink());
        assertEquals(walk(automaton, "s"), automaton.node(walk(automaton, "his")).getSuffixLink());
        assertEquals(walk(automaton, "s"), automaton.node(walk(automaton, "hers")).getSuffixLink());
        assertEquals(ROOT, automaton.node(walk(automaton, "her")).getSuffixLink());
    }

    @Test
    public void testTerminalLinks() {
        assertEquals(NO_LINK, automaton.node(ROOT).getTerminalLink());
        assertEquals(walk(automaton, "he"), automaton.node(walk(automaton, "she")).getTerminalLink());
        assertEquals(NO_LINK, automaton.node(walk(automaton, "he")).getTerminalLink());
        assertEquals(NO_LINK, automaton.node(walk(automaton, "hers")).getTerminalLink());
        assertEquals(NO_LINK, automaton.node(walk(automaton, "his")).getTerminalLink());
    }

    @Test
    public void testTerminalLinkSkipsNonTerminalSuffixes() {
        // "xab" -> suffix "ab" (not a word) -> terminal is "b"
        Automaton a = new AutomatonBuilder().add("xab", 0).add("abc", 1).add("b", 2).build();
        assertEquals(walk(a, "ab"), a.node(walk(a, "xab")).getSuffixLink());
        assertEquals(walk(a, "b"), a.node(walk(a, "xab")).getTerminalLink());
    }

    @Test
    public void testAutomatonTransitions() {
        int she = walk(automaton, "she");
        assertEquals(walk(automaton, "her"), automaton.automatonTransition(she, 'r'));
        assertEquals(walk(automaton, "s"), automaton.automatonTransition(she, 's'));
        assertEquals(ROOT, automaton.automatonTransition(she, 'x'));
        assertEquals(ROOT, automaton.automatonTransition(ROOT, 'u'));
        assertEquals(walk(automaton, "h"), automaton.automatonTransition(ROOT, 'h'));
    }

    @Test
    public void testAutomatonTransitionsAreCachedAlongTheSuffixChain() {
        int she = walk(automaton, "she");
        int he = walk(automaton, "he");
        assertEquals(NO_LINK, automaton.node(she).getCachedTransition('r'));

        int her = automaton.automatonTransition(she, 'r');

        assertEquals(her, automaton.node(she).getCachedTransition('r'));
        assertEquals(her, automaton.node(he).getCachedTransition('r'));
        assertEquals(her, automaton.automatonTransition(she, 'r'));
    }

    @Test
    public void testEmptyWordEndsAtRoot() {
        Automaton a = new AutomatonBuilder().add("", 7).add("a", 1).build();
        assertEquals(1, a.node(ROOT).getTerminatedIds().size());
        assertEquals(7, a.node(ROOT).getTerminatedIds().getInt(0));
        // the root ends a word, so it is every other node's terminal link
        assertEquals(ROOT, a.node(walk(a, "a")).getTerminalLink());
        assertEquals(NO_LINK, a.node(ROOT).getTerminalLink());
    }

    @Test
    public void testDuplicateWordsKeepAllIds() {
        Automaton a = new AutomatonBuilder().add("ab", 2).add("ab", 5).build();
        assertEquals(3, a.size());
        assertEquals(2, a.node(walk(a, "ab")).getTerminatedIds().size());
        assertTrue(a.node(walk(a, "ab")).getTerminatedIds().contains(5));
    }

    @Test
    public void testLongWordDoesNotOverflowTheStack() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 200_000; i++) {
            sb.append('a');
        }
        Automaton a = new AutomatonBuilder().add(sb.toString(), 0).add("b", 1).build();
        int deepest = walk(a, sb.toString());
        assertEquals(walk(a, "b"), a.automatonTransition(deepest, 'b'));
    }
}
