package io.github.eutro.fungraph.core.passes;

import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.passes.misc.ChainedPass;

/**
 * One step of finishing a built {@link GraphContext}: an analysis that annotates it,
 * an optimization that rewrites it, or a conversion to another form such as the export.
 * <p>
 * Passes that return their input are {@link InPlaceIRPass in-place}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass returns its input, annotated or rewritten.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Feed the result of this pass to {@code next}.
     *
     * @param next The pass to run after this one.
     * @param <C>  The result type of {@code next}.
     * @return The chain; a failure in it names the index of the failing pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
