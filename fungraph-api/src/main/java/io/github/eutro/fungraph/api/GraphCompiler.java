package io.github.eutro.fungraph.api;

import io.github.eutro.fungraph.api.events.*;
import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.passes.convert.GraphExport;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Creates {@link GraphCompilation}s for area-template trees, with shared listeners and options.
 */
public class GraphCompiler extends EventSupplier<CompilerEvent> {
    @NotNull
    private GraphOptions options;

    public GraphCompiler(@NotNull GraphOptions options) {
        this.options = options;
    }

    public GraphCompiler() {
        this(GraphOptions.DEFAULT);
    }

    @NotNull
    public GraphOptions getOptions() {
        return options;
    }

    public GraphCompiler setOptions(@NotNull GraphOptions options) {
        this.options = options;
        return this;
    }

    /**
     * Create a compilation of the given templates.
     *
     * @param templates The area-template tree, with its context definitions.
     * @return The compilation, which does nothing until it is {@link GraphCompilation#run() run}.
     */
    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    public GraphCompilation submit(@NotNull TemplateTree templates) {
        return new GraphCompilation(this, templates, options);
    }

    /**
     * Get a dispatcher that listens to events of every compilation of this compiler.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<GraphCompileEvent> lift() {
        return new EventDispatcher<GraphCompileEvent>() {
            @Override
            public <T extends GraphCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                GraphCompiler.this.listen(RunGraphCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect the export forms emitted by every compilation of this compiler.
     *
     * @return The list they are added to.
     */
    public List<GraphExport> exportsAsList() {
        List<GraphExport> exports = new ArrayList<>();
        lift().listen(EmitExportEvent.class, evt -> exports.add(evt.export));
        return exports;
    }
}
