package io.github.eutro.fungraph.core.build;

import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.scope.AreaTemplate;

/**
 * Builds the node for an expression of an area template, such as the definition
 * of a context attribute or one alternative of a variant.
 */
@FunctionalInterface
public interface ContextDefinition {
    /**
     * Build the expression.
     *
     * @param builder  The builder.
     * @param template The template the expression is evaluated in.
     * @param known    The qualifiers known to hold where it is evaluated.
     * @return The node, which may be uncached.
     */
    FunctionNode build(GraphBuilder builder, AreaTemplate template, KnownQualifiers known);

    /**
     * A definition that always builds the same constant.
     *
     * @param value The constant.
     * @return The definition.
     */
    static ContextDefinition constant(Object value) {
        return (b, t, k) -> b.constant(value);
    }
}
