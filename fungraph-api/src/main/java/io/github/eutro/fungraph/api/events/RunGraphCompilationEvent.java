package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.api.GraphCompilation;
import io.github.eutro.fungraph.api.GraphCompiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a graph compilation is started.
 *
 * @see GraphCompiler
 * @see GraphCompilation
 */
public class RunGraphCompilationEvent implements CompilerEvent {
    /**
     * The graph compilation.
     */
    @NotNull
    public GraphCompilation compilation;

    /**
     * Construct a new graph compilation event.
     *
     * @param compilation The compilation.
     */
    public RunGraphCompilationEvent(@NotNull GraphCompilation compilation) {
        this.compilation = compilation;
    }
}
