package io.github.eutro.fungraph.core.diag;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A located message produced while building the graph.
 */
public final class Diagnostic {
    /**
     * How bad a diagnostic is.
     */
    public enum Severity {
        /**
         * Compilation continues, with a defined fallback.
         */
        WARNING,
        /**
         * Compilation of the pass is aborted.
         */
        ERROR,
    }

    /**
     * The classes of problem the builder reports.
     */
    public enum Kind {
        SCOPE_INCOMPATIBILITY(Severity.ERROR),
        STRUCTURAL_CYCLE(Severity.ERROR),
        CYCLIC_QUALIFIER(Severity.WARNING),
        SCHEDULING_ORDER(Severity.WARNING),
        UNSUPPORTED_WRITE_TARGET(Severity.WARNING),
        INCONSISTENT_CACHE(Severity.ERROR),
        ;

        /**
         * The severity diagnostics of this kind have by default.
         */
        public final Severity defaultSeverity;

        Kind(Severity defaultSeverity) {
            this.defaultSeverity = defaultSeverity;
        }
    }

    @NotNull
    public final Kind kind;
    @NotNull
    public final Severity severity;
    @NotNull
    public final String message;
    /**
     * The construct the diagnostic is about (an attribute path, a write handler name...),
     * which also scopes deduplication.
     */
    @Nullable
    public final String construct;

    public Diagnostic(@NotNull Kind kind, @NotNull Severity severity, @NotNull String message, @Nullable String construct) {
        this.kind = kind;
        this.severity = severity;
        this.message = message;
        this.construct = construct;
    }

    public Diagnostic(@NotNull Kind kind, @NotNull String message, @Nullable String construct) {
        this(kind, kind.defaultSeverity, message, construct);
    }

    /**
     * Whether this diagnostic aborts compilation.
     *
     * @return Whether the severity is {@link Severity#ERROR}.
     */
    public boolean isFatal() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind
                && severity == that.severity
                && message.equals(that.message)
                && Objects.equals(construct, that.construct);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, message, construct);
    }

    @Override
    public String toString() {
        return severity + " " + kind + (construct == null ? "" : " @ " + construct) + ": " + message;
    }
}
