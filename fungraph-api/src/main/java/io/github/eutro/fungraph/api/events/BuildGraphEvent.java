package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.core.build.GraphBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the graph context exists, before the context attributes of the templates are built.
 * Listeners lower their expressions with the builder: exports, class memberships, writes and roots.
 */
public class BuildGraphEvent implements GraphCompileEvent {
    @NotNull
    public final GraphBuilder builder;

    public BuildGraphEvent(@NotNull GraphBuilder builder) {
        this.builder = builder;
    }
}
