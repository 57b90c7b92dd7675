package io.github.eutro.fungraph.core.diag;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when graph construction cannot continue. Unwinds the whole compilation pass.
 */
public class CompilationException extends RuntimeException {
    @NotNull
    private final Diagnostic diagnostic;

    public CompilationException(@NotNull Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public CompilationException(@NotNull Diagnostic diagnostic, Throwable cause) {
        super(diagnostic.toString(), cause);
        this.diagnostic = diagnostic;
    }

    /**
     * Get the diagnostic describing the failure.
     *
     * @return The diagnostic.
     */
    @NotNull
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
