package software.amazon.fuzzy.matcher;

/**
 * Computes terminal links during a second breadth-first pass, once every suffix link is known. A node's terminal
 * link is its suffix link if that node ends a word, otherwise the suffix link's own terminal link.
 */
class TerminalLinkCalculator {

    private final Automaton automaton;

    TerminalLinkCalculator(final Automaton automaton) {
        this.automaton = automaton;
    }

    BfsVisitor<Integer, TrieEdge> visitor() {
        return BfsVisitor.<Integer, TrieEdge>builder()
                .onDiscoverVertex(this::discoverVertex)
                .build();
    }

    void discoverVertex(final int index) {
        final AutomatonNode node = automaton.node(index);
        final int suffixParent = node.getSuffixLink();

        // only the root is its own suffix; it has no terminal link
        if (suffixParent == index) {
            return;
        }

        final AutomatonNode suffixNode = automaton.node(suffixParent);
        if (suffixNode.isTerminal()) {
            node.setTerminalLink(suffixParent);
        } else {
            node.setTerminalLink(suffixNode.getTerminalLink());
        }
    }
}
