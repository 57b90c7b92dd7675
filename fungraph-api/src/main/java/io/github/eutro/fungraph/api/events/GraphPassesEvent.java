package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.passes.IRPass;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after the graph is complete, before the passes that finish it run.
 * Listeners may chain extra passes onto {@link #passes}.
 */
public class GraphPassesEvent implements GraphCompileEvent {
    /**
     * The completed graph.
     */
    @NotNull
    public final GraphContext graph;
    /**
     * The passes that will run on the graph before it is exported.
     */
    @NotNull
    public IRPass<GraphContext, GraphContext> passes;

    public GraphPassesEvent(@NotNull GraphContext graph, @NotNull IRPass<GraphContext, GraphContext> passes) {
        this.graph = graph;
        this.passes = passes;
    }
}
