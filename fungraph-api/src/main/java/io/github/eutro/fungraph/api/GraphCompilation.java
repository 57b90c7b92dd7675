package io.github.eutro.fungraph.api;

import io.github.eutro.fungraph.api.events.*;
import io.github.eutro.fungraph.core.build.GraphBuilder;
import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.diag.CompilationException;
import io.github.eutro.fungraph.core.diag.Diagnostics;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.passes.IRPass;
import io.github.eutro.fungraph.core.passes.Passes;
import io.github.eutro.fungraph.core.passes.convert.ExportGraph;
import io.github.eutro.fungraph.core.passes.convert.GraphExport;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Represents the compilation of a single area-template tree into a function graph.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunGraphCompilationEvent} is fired on the {@link GraphCompiler compiler}.</li>
 *     <li>A new graph context is created and its generation advanced.</li>
 *     <li>{@link BuildGraphEvent} is fired, for listeners to lower their expressions.</li>
 *     <li>The context attributes of every template are built, and the graph is completed.</li>
 *     <li>{@link GraphPassesEvent} is fired.</li>
 *     <li>The {@link Passes#FINISH_GRAPH finishing passes} are run: write reachability, then compaction.</li>
 *     <li>The graph is {@link ExportGraph exported}.</li>
 *     <li>{@link EmitExportEvent} is fired.</li>
 * </ol>
 * Every diagnostic is fired as a {@link DiagnosticEvent} when it is reported.
 */
public class GraphCompilation extends EventSupplier<GraphCompileEvent> {
    private static final Logger logger = LogManager.getLogger();

    private final GraphCompiler cc;
    private final Diagnostics diagnostics;

    /**
     * The templates being compiled.
     */
    @NotNull
    public final TemplateTree templates;
    @NotNull
    private final GraphOptions options;
    @Nullable
    private GraphContext graph;

    GraphCompilation(GraphCompiler cc, @NotNull TemplateTree templates, @NotNull GraphOptions options) {
        this.cc = cc;
        this.templates = templates;
        this.options = options;
        this.diagnostics = new Diagnostics(d -> dispatch(DiagnosticEvent.class, new DiagnosticEvent(d)));
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Get the graph, once the compilation has started.
     *
     * @return The graph context, or null.
     */
    @Nullable
    public GraphContext getGraph() {
        return graph;
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The export form of the graph.
     * @throws CompilationException If the graph could not be built; its diagnostic has been reported.
     */
    public GraphExport run() {
        cc.dispatch(RunGraphCompilationEvent.class, new RunGraphCompilationEvent(this));
        GraphContext ctx = new GraphContext(options, templates, diagnostics);
        graph = ctx;
        int generation = ctx.nextGeneration();
        logger.debug("compiling {} templates, generation {}", templates.getTemplates().size(), generation);
        try {
            GraphBuilder builder = new GraphBuilder(ctx);
            dispatch(BuildGraphEvent.class, new BuildGraphEvent(builder));
            builder.buildAll();
            builder.complete();

            IRPass<GraphContext, GraphContext> passes =
                    dispatch(GraphPassesEvent.class, new GraphPassesEvent(ctx, Passes.FINISH_GRAPH)).passes;
            passes.run(ctx);

            GraphExport export = ExportGraph.INSTANCE.run(ctx);
            return dispatch(EmitExportEvent.class, new EmitExportEvent(export)).export;
        } catch (CompilationException e) {
            diagnostics.report(e.getDiagnostic());
            throw e;
        }
    }
}
