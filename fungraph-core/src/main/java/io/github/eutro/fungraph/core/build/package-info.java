/**
 * Lowering of area templates, context attributes, variants and writes into the function graph.
 *
 * @see io.github.eutro.fungraph.core.build.GraphBuilder
 */
package io.github.eutro.fungraph.core.build;
