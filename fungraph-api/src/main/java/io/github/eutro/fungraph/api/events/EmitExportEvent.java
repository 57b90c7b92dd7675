package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.api.GraphCompilation;
import io.github.eutro.fungraph.core.passes.convert.GraphExport;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when the export form of the graph should be emitted.
 *
 * @see GraphCompilation
 */
public class EmitExportEvent implements GraphCompileEvent, CancellableEvent {
    /**
     * The export form.
     */
    @NotNull
    public GraphExport export;
    private boolean cancelled = false;

    public EmitExportEvent(@NotNull GraphExport export) {
        this.export = export;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
