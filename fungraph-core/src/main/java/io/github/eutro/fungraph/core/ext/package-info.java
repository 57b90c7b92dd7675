/**
 * Typed side data on graph nodes and built-in function keys.
 *
 * <pre>{@code
 * node.attachExt(GraphExts.ORIGIN, "display.color");
 * node.getNullable(GraphExts.ORIGIN); // => "display.color"
 * }</pre>
 * <p>
 * Passes keep scratch data here ({@link io.github.eutro.fungraph.core.ext.GraphExts#WRITE_USERS}),
 * and the function catalogue attaches per-function rules (purity, folding, write-through arguments)
 * to each {@link io.github.eutro.fungraph.core.graph.BuiltInFunction}, which function application
 * nodes read from their function.
 */
package io.github.eutro.fungraph.core.ext;
