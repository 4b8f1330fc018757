package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.chars.Char2IntAVLTreeMap;
import it.unimi.dsi.fastutil.chars.Char2IntMap;
import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;
import it.unimi.dsi.fastutil.chars.Char2IntSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import javax.annotation.concurrent.NotThreadSafe;

import static software.amazon.fuzzy.matcher.Automaton.NO_LINK;

/**
 * A state of the Aho-Corasick automaton. Nodes are owned by an {@link Automaton} and refer to each other by their
 * index in it: the trie transitions point to children, the suffix and terminal links point back towards the root.
 */
@NotThreadSafe
class AutomatonNode {

    // Sorted so that traversals over the trie visit children in a stable order.
    private final Char2IntSortedMap trieTransitions = new Char2IntAVLTreeMap();

    // Ids of the words that end exactly at this node. Several words may share a node if they are equal.
    private final IntList terminatedIds = new IntArrayList(1);

    // Resolved automaton transitions; only ever grows.
    private final Char2IntMap gotoCache = new Char2IntOpenHashMap(2);

    private int suffixLink = NO_LINK;
    private int terminalLink = NO_LINK;

    AutomatonNode() {
        trieTransitions.defaultReturnValue(NO_LINK);
        gotoCache.defaultReturnValue(NO_LINK);
    }

    int getTrieTransition(final char character) {
        return trieTransitions.get(character);
    }

    void putTrieTransition(final char character, final int child) {
        trieTransitions.put(character, child);
    }

    Char2IntSortedMap getTrieTransitions() {
        return trieTransitions;
    }

    int getCachedTransition(final char character) {
        return gotoCache.get(character);
    }

    void cacheTransition(final char character, final int target) {
        gotoCache.put(character, target);
    }

    IntList getTerminatedIds() {
        return terminatedIds;
    }

    void addTerminatedId(final int id) {
        terminatedIds.add(id);
    }

    boolean isTerminal() {
        return !terminatedIds.isEmpty();
    }

    int getSuffixLink() {
        return suffixLink;
    }

    void setSuffixLink(final int suffixLink) {
        this.suffixLink = suffixLink;
    }

    int getTerminalLink() {
        return terminalLink;
    }

    void setTerminalLink(final int terminalLink) {
        this.terminalLink = terminalLink;
    }

    @Override
    public String toString() {
        return "AN: transitions=" + trieTransitions + " ids=" + terminatedIds + " suffix=" + suffixLink
                + " terminal=" + terminalLink;
    }
}
