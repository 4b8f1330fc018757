package software.amazon.fuzzy.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * A trie transition of an {@link Automaton}, from the node at index {@code source} to its child {@code target},
 * labelled with {@code character}.
 */
@Immutable
final class TrieEdge {

    final int source;
    final int target;
    final char character;

    TrieEdge(final int source, final int target, final char character) {
        this.source = source;
        this.target = target;
        this.character = character;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TrieEdge other = (TrieEdge) o;
        return source == other.source && target == other.target && character == other.character;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, character);
    }

    @Override
    public String toString() {
        return source + " -" + character + "-> " + target;
    }
}
