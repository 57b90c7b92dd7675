package io.github.eutro.fungraph.core.diag;

/**
 * Receives the diagnostics of a compilation pass.
 */
@FunctionalInterface
public interface DiagnosticSink {
    /**
     * Report a diagnostic.
     *
     * @param diagnostic The diagnostic.
     */
    void report(Diagnostic diagnostic);
}
