package software.amazon.fuzzy.matcher;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The callbacks fired by {@link BreadthFirstSearch}. Any callback left unset does nothing.
 */
@Immutable
final class BfsVisitor<V, E> {

    private final Consumer<V> discoverVertex;
    private final Consumer<V> examineVertex;
    private final Consumer<E> examineEdge;

    private BfsVisitor(final Consumer<V> discoverVertex, final Consumer<V> examineVertex,
                       final Consumer<E> examineEdge) {
        this.discoverVertex = discoverVertex;
        this.examineVertex = examineVertex;
        this.examineEdge = examineEdge;
    }

    void discoverVertex(final V vertex) {
        discoverVertex.accept(vertex);
    }

    void examineVertex(final V vertex) {
        examineVertex.accept(vertex);
    }

    void examineEdge(final E edge) {
        examineEdge.accept(edge);
    }

    static <V, E> Builder<V, E> builder() {
        return new Builder<>();
    }

    static final class Builder<V, E> {

        private Consumer<V> discoverVertex = vertex -> { };
        private Consumer<V> examineVertex = vertex -> { };
        private Consumer<E> examineEdge = edge -> { };

        private Builder() { }

        Builder<V, E> onDiscoverVertex(@Nonnull final Consumer<V> discoverVertex) {
            this.discoverVertex = Objects.requireNonNull(discoverVertex, "discoverVertex");
            return this;
        }

        Builder<V, E> onExamineVertex(@Nonnull final Consumer<V> examineVertex) {
            this.examineVertex = Objects.requireNonNull(examineVertex, "examineVertex");
            return this;
        }

        Builder<V, E> onExamineEdge(@Nonnull final Consumer<E> examineEdge) {
            this.examineEdge = Objects.requireNonNull(examineEdge, "examineEdge");
            return this;
        }

        BfsVisitor<V, E> build() {
            return new BfsVisitor<>(discoverVertex, examineVertex, examineEdge);
        }
    }
}
