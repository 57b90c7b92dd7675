package io.github.eutro.fungraph.api.events;

/**
 * An event whose remaining listeners are skipped once a listener cancels it.
 * Cancelling an {@link EmitExportEvent} keeps later listeners, such as
 * {@link io.github.eutro.fungraph.api.GraphCompiler#exportsAsList()}, from collecting the export.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}
