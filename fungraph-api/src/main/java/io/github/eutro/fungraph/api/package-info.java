/**
 * The compilation driver: a {@link io.github.eutro.fungraph.api.GraphCompiler} creates
 * {@link io.github.eutro.fungraph.api.GraphCompilation}s, whose progress can be observed and
 * extended through {@link io.github.eutro.fungraph.api.events events}.
 */
package io.github.eutro.fungraph.api;
