package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.api.GraphCompiler;

/**
 * An event fired on a {@link GraphCompiler}.
 */
public interface CompilerEvent {
}
