/**
 * Events that occur during a compilation.
 * <p>
 * These can be used to feed expressions to the builder, to run extra passes,
 * to observe diagnostics and to collect the export form.
 * <p>
 * The API revolves around {@link io.github.eutro.fungraph.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.fungraph.api.events;
