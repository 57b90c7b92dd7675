package io.github.eutro.fungraph.core.diag;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A self-reference that could not be repaired.
 */
public class CycleException extends CompilationException {
    private final List<String> trace;

    /**
     * Construct a cycle exception.
     *
     * @param construct The construct the cycle was found in, if known.
     * @param trace     The probe stack at detection, outermost first.
     */
    public CycleException(@Nullable String construct, List<String> trace) {
        super(new Diagnostic(Diagnostic.Kind.STRUCTURAL_CYCLE,
                "cycle detected:\n  " + String.join("\n  ", trace),
                construct));
        this.trace = Collections.unmodifiableList(trace);
    }

    /**
     * Get the probe-stack trace.
     *
     * @return The frames, outermost first.
     */
    public List<String> getTrace() {
        return trace;
    }
}
