package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.chars.Char2IntMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Exposes the trie of an {@link Automaton} to {@link BreadthFirstSearch}. Vertices are node indexes, edges are
 * trie transitions only; suffix and terminal links are not edges.
 */
class AutomatonGraph implements Graph<Integer, TrieEdge> {

    private final Automaton automaton;

    AutomatonGraph(final Automaton automaton) {
        this.automaton = automaton;
    }

    @Override
    public Iterable<TrieEdge> outgoingEdges(final Integer vertex) {
        final AutomatonNode node = automaton.node(vertex);
        final List<TrieEdge> edges = new ArrayList<>(node.getTrieTransitions().size());
        for (Char2IntMap.Entry transition : node.getTrieTransitions().char2IntEntrySet()) {
            edges.add(new TrieEdge(vertex, transition.getIntValue(), transition.getCharKey()));
        }
        return edges;
    }

    @Override
    public Integer target(final TrieEdge edge) {
        return edge.target;
    }
}
