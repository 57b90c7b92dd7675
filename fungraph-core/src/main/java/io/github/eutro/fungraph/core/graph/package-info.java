/**
 * The function graph: the node catalogue, the per-scope hash-consing caches and
 * the {@link io.github.eutro.fungraph.core.graph.GraphContext} that internalizes nodes into them.
 * <p>
 * Nodes are built uncached and internalized bottom-up. Variants whose guards depend on their own value are
 * repaired by specializing their alternatives under their guards
 * ({@link io.github.eutro.fungraph.core.graph.FunctionNode#pickQualifiedExpression}); other cycles are fatal.
 */
package io.github.eutro.fungraph.core.graph;
