package io.github.eutro.fungraph.core.graph;

import java.util.Collections;
import java.util.List;

/**
 * Returned instead of a cached node when internalization ran into a node that cannot be cached yet:
 * a variant whose guard depends on its own value, or a forward reference that is not resolved yet.
 * <p>
 * The signal unwinds to the internalization of the node with the same sequence number, which
 * repairs itself; any other node stays uncached and is internalized again later.
 */
public final class CycleSignal {
    public final int seqNr;
    public final List<String> trace;

    public CycleSignal(int seqNr, List<String> trace) {
        this.seqNr = seqNr;
        this.trace = Collections.unmodifiableList(trace);
    }

    @Override
    public String toString() {
        return "CycleSignal{#" + seqNr + "}";
    }
}
