package io.github.eutro.fungraph.core.passes;

/**
 * A pass that annotates or rewrites a graph without producing a new one,
 * such as {@link io.github.eutro.fungraph.core.passes.meta.MarkWritables}.
 *
 * @param <T> The type of the graph.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Annotate or rewrite the graph.
     *
     * @param t The graph.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
