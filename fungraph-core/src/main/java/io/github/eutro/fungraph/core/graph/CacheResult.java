package io.github.eutro.fungraph.core.graph;

import org.jetbrains.annotations.NotNull;

/**
 * The outcome of {@link GraphContext#internalize(FunctionNode)}: either the cached node,
 * or a {@link CycleSignal} saying the node could not be cached yet.
 */
public final class CacheResult {
    private final FunctionNode node;
    private final CycleSignal signal;

    private CacheResult(FunctionNode node, CycleSignal signal) {
        this.node = node;
        this.signal = signal;
    }

    public static CacheResult of(@NotNull FunctionNode node) {
        return new CacheResult(node, null);
    }

    public static CacheResult pending(@NotNull CycleSignal signal) {
        return new CacheResult(null, signal);
    }

    public boolean isCached() {
        return node != null;
    }

    @NotNull
    public FunctionNode getNode() {
        if (node == null) throw new IllegalStateException("not cached: " + signal);
        return node;
    }

    @NotNull
    public CycleSignal getSignal() {
        if (signal == null) throw new IllegalStateException("cached: " + node);
        return signal;
    }

    @Override
    public String toString() {
        return node != null ? "cached " + node : "pending " + signal;
    }
}
