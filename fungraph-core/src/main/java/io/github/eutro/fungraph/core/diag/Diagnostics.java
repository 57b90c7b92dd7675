package io.github.eutro.fungraph.core.diag;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The diagnostic stream of one compilation: logs every diagnostic, keeps them for inspection,
 * deduplicates warnings per (kind, construct) and forwards them to a downstream sink.
 */
public class Diagnostics implements DiagnosticSink {
    private static final Logger logger = LogManager.getLogger();

    private final List<Diagnostic> reported = new ArrayList<>();
    private final Set<List<Object>> seenWarnings = new HashSet<>();
    @Nullable
    private final DiagnosticSink downstream;

    public Diagnostics(@Nullable DiagnosticSink downstream) {
        this.downstream = downstream;
    }

    public Diagnostics() {
        this(null);
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (!diagnostic.isFatal() && !seenWarnings.add(Arrays.<Object>asList(diagnostic.kind,
                diagnostic.construct == null ? diagnostic.message : diagnostic.construct))) {
            return;
        }
        if (diagnostic.isFatal()) {
            logger.error("{}", diagnostic);
        } else {
            logger.warn("{}", diagnostic);
        }
        reported.add(diagnostic);
        if (downstream != null) {
            downstream.report(diagnostic);
        }
    }

    /**
     * Report a warning once per construct.
     *
     * @param kind      The kind of warning.
     * @param message   The message.
     * @param construct The construct it is about, or null.
     */
    public void warnOnce(Diagnostic.Kind kind, @NotNull String message, @Nullable String construct) {
        report(new Diagnostic(kind, Diagnostic.Severity.WARNING, message, construct));
    }

    /**
     * Get all diagnostics reported so far.
     *
     * @return An unmodifiable view of the diagnostics.
     */
    public List<Diagnostic> getReported() {
        return Collections.unmodifiableList(reported);
    }

    /**
     * Count the diagnostics of a kind.
     *
     * @param kind The kind.
     * @return The number reported.
     */
    public int count(Diagnostic.Kind kind) {
        int n = 0;
        for (Diagnostic d : reported) {
            if (d.kind == kind) n++;
        }
        return n;
    }

    /**
     * Whether any fatal diagnostic was reported.
     *
     * @return Whether compilation failed.
     */
    public boolean hasErrors() {
        for (Diagnostic d : reported) {
            if (d.isFatal()) return true;
        }
        return false;
    }
}
