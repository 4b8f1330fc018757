package software.amazon.fuzzy.matcher;

import static software.amazon.fuzzy.matcher.Automaton.ROOT;

/**
 * Computes suffix links during a breadth-first pass over the trie. A child's suffix link is resolved through its
 * parent's, which the breadth-first order guarantees to be final already.
 */
class SuffixLinkCalculator {

    private final Automaton automaton;

    SuffixLinkCalculator(final Automaton automaton) {
        this.automaton = automaton;
    }

    BfsVisitor<Integer, TrieEdge> visitor() {
        return BfsVisitor.<Integer, TrieEdge>builder()
                .onExamineVertex(this::examineVertex)
                .onExamineEdge(this::examineEdge)
                .build();
    }

    void examineVertex(final int index) {
        if (index == ROOT) {
            automaton.node(index).setSuffixLink(index);
        }
    }

    void examineEdge(final TrieEdge edge) {
        final AutomatonNode parent = automaton.node(edge.source);
        final AutomatonNode child = automaton.node(edge.target);

        // the parent is the root
        if (parent.getSuffixLink() == edge.source) {
            child.setSuffixLink(edge.source);
            return;
        }

        child.setSuffixLink(automaton.automatonTransition(parent.getSuffixLink(), edge.character));
    }
}
