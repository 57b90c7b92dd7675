package io.github.eutro.fungraph.api.events;

import io.github.eutro.fungraph.core.diag.Diagnostic;
import org.jetbrains.annotations.NotNull;

/**
 * Fired for every diagnostic of a compilation, as it is reported. Duplicate warnings are not fired again.
 */
public class DiagnosticEvent implements GraphCompileEvent {
    @NotNull
    public final Diagnostic diagnostic;

    public DiagnosticEvent(@NotNull Diagnostic diagnostic) {
        this.diagnostic = diagnostic;
    }
}
