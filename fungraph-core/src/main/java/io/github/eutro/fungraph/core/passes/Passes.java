package io.github.eutro.fungraph.core.passes;

import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.passes.convert.ExportGraph;
import io.github.eutro.fungraph.core.passes.convert.GraphExport;
import io.github.eutro.fungraph.core.passes.meta.MarkWritables;
import io.github.eutro.fungraph.core.passes.opts.CompactGraph;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Passes that must run on a completed graph before it is exported.
     */
    public static final IRPass<GraphContext, GraphContext> FINISH_GRAPH =
            MarkWritables.INSTANCE
                    .then(CompactGraph.INSTANCE);

    /**
     * Finish a completed graph and convert it to its export form.
     */
    public static final IRPass<GraphContext, GraphExport> EXPORT =
            FINISH_GRAPH.then(ExportGraph.INSTANCE);
}
