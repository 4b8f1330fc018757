package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * An Aho-Corasick automaton: a trie of words whose nodes carry suffix and terminal links, plus a memoized goto
 * function. Nodes are stored in an arena and addressed by index; {@link #ROOT} is always the first node and
 * {@link #NO_LINK} stands for a missing transition or link.
 * <p>
 * The structure of the trie and its links are fixed once {@link AutomatonBuilder#build()} returns. Resolving
 * transitions still fills per-node caches, which is why instances must not be shared between threads.
 */
@NotThreadSafe
public class Automaton {

    static final int ROOT = 0;
    static final int NO_LINK = -1;

    private final List<AutomatonNode> nodes = new ArrayList<>();

    Automaton() {
        nodes.add(new AutomatonNode());
    }

    /**
     * @return a reference to the start state of this automaton
     */
    public NodeReference root() {
        return new NodeReference(this, ROOT);
    }

    /**
     * @return the number of trie nodes, the root included
     */
    public int size() {
        return nodes.size();
    }

    AutomatonNode node(final int index) {
        return nodes.get(index);
    }

    /**
     * Inserts a word into the trie, sharing the prefixes already present, and records its id at the last node.
     * The empty word ends at the root.
     */
    void addString(final String word, final int id) {
        int last = ROOT;
        for (int i = 0; i < word.length(); i++) {
            final char label = word.charAt(i);
            int child = node(last).getTrieTransition(label);
            if (child == NO_LINK) {
                child = nodes.size();
                nodes.add(new AutomatonNode());
                node(last).putTrieTransition(label, child);
            }
            last = child;
        }
        node(last).addTerminatedId(id);
    }

    /**
     * @return the child reached from the node by the given character, or {@link #NO_LINK}
     */
    int trieTransition(final int index, final char character) {
        return node(index).getTrieTransition(character);
    }

    /**
     * The goto function of the automaton. Resolves to the trie transition if there is one, loops back to the root
     * when the root has none, and otherwise falls back along the suffix link. Results are cached at every node
     * walked through, so each node resolves each character at most once and a scan costs O(1) amortized per
     * character.
     * <p>
     * The suffix link chain is walked iteratively: its length is bounded by the depth of the trie, which can be as
     * long as the longest word.
     */
    int automatonTransition(final int index, final char character) {
        final int cached = node(index).getCachedTransition(character);
        if (cached != NO_LINK) {
            return cached;
        }

        final IntArrayList unresolved = new IntArrayList();
        int current = index;
        int target;
        while (true) {
            final AutomatonNode node = node(current);
            target = node.getCachedTransition(character);
            if (target != NO_LINK) {
                break;
            }
            unresolved.add(current);
            target = node.getTrieTransition(character);
            if (target != NO_LINK) {
                break;
            }
            if (current == ROOT) {
                target = ROOT;
                break;
            }
            current = node.getSuffixLink();
        }

        for (int i = 0; i < unresolved.size(); i++) {
            node(unresolved.getInt(i)).cacheTransition(character, target);
        }
        return target;
    }

    @Override
    public String toString() {
        return "Automaton{nodes=" + nodes.size() + "}";
    }
}
