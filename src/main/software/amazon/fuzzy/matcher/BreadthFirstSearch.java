package software.amazon.fuzzy.matcher;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Generic breadth-first traversal. Every vertex reachable from the origin is discovered once and examined once,
 * every edge leaving an examined vertex is examined once, and vertices are discovered in non-decreasing distance
 * from the origin. A vertex that has already been discovered is never queued again, so cycles are not followed.
 */
final class BreadthFirstSearch {

    private BreadthFirstSearch() { }

    static <V, E> void traverse(@Nonnull final V origin, @Nonnull final Graph<V, E> graph,
                                @Nonnull final BfsVisitor<V, E> visitor) {
        final Set<V> discovered = new HashSet<>();
        final Queue<V> toProcess = new ArrayDeque<>();

        toProcess.add(origin);
        discovered.add(origin);
        visitor.discoverVertex(origin);

        while (!toProcess.isEmpty()) {
            final V examined = toProcess.remove();
            visitor.examineVertex(examined);

            for (E edge : graph.outgoingEdges(examined)) {
                visitor.examineEdge(edge);

                final V child = graph.target(edge);
                if (discovered.add(child)) {
                    toProcess.add(child);
                    visitor.discoverVertex(child);
                }
            }
        }
    }
}
