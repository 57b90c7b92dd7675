package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.api.GraphCompilation;

/**
 * An event fired during a single graph compilation.
 *
 * @see GraphCompilation
 */
public interface GraphCompileEvent {
}
