package software.amazon.fuzzy.matcher;

/**
 * A directed graph as seen by {@link BreadthFirstSearch}: a way to list the edges leaving a vertex and to find
 * the vertex an edge leads to.
 *
 * @param <V> vertex type, compared with equals/hashCode
 * @param <E> edge type
 */
interface Graph<V, E> {

    Iterable<E> outgoingEdges(V vertex);

    V target(E edge);
}
