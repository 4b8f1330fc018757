package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.ints.IntList;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;
import java.util.function.IntConsumer;

import static software.amazon.fuzzy.matcher.Automaton.NO_LINK;
import static software.amazon.fuzzy.matcher.Automaton.ROOT;

/**
 * A cursor over the states of an {@link Automaton}. Moving the cursor never changes it; {@link #next(char)} returns
 * a new reference. {@link #EMPTY} refers to no automaton at all and only answers {@link #isPresent()}.
 */
@Immutable
public final class NodeReference {

    public static final NodeReference EMPTY = new NodeReference(null, NO_LINK);

    private final Automaton automaton;
    private final int node;

    NodeReference(final Automaton automaton, final int node) {
        this.automaton = automaton;
        this.node = node;
    }

    /**
     * @param character the next input character
     * @return the state the automaton moves to on {@code character}
     */
    public NodeReference next(final char character) {
        return new NodeReference(automaton(), automaton.automatonTransition(node, character));
    }

    /**
     * Reports the id of every word that ends at the current position of the input, i.e. every word that is a
     * suffix of the path to this state. Ids of the state itself come first, then those found along the chain of
     * terminal links.
     *
     * @param onMatch called once per matched id
     */
    public void generateMatches(@Nonnull final IntConsumer onMatch) {
        Objects.requireNonNull(onMatch, "onMatch");
        int current = node;
        do {
            final AutomatonNode currentNode = automaton().node(current);
            final IntList terminatedIds = currentNode.getTerminatedIds();
            for (int i = 0; i < terminatedIds.size(); i++) {
                onMatch.accept(terminatedIds.getInt(i));
            }
            current = currentNode.getTerminalLink();
        } while (current != NO_LINK);
    }

    /**
     * @return true if some word ends exactly at this state
     */
    public boolean isTerminal() {
        return automaton().node(node).isTerminal();
    }

    public boolean isRoot() {
        return automaton != null && node == ROOT;
    }

    public boolean isPresent() {
        return automaton != null;
    }

    private Automaton automaton() {
        if (automaton == null) {
            throw new IllegalStateException("Reference is not attached to an automaton");
        }
        return automaton;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeReference other = (NodeReference) o;
        return automaton == other.automaton && node == other.node;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(automaton) + node;
    }

    @Override
    public String toString() {
        return isPresent() ? "NR: " + node : "NR: empty";
    }
}
