package io.github.eutro.fungraph.core.util;

/**
 * A simple unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, kept short because graph
 * rewrites pass a lot of them around.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    /**
     * Apply the function.
     *
     * @param a The argument.
     * @return The result.
     */
    B apply(A a);
}
