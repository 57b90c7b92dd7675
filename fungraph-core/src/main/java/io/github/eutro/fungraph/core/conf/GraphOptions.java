package io.github.eutro.fungraph.core.conf;

import org.jetbrains.annotations.Contract;

/**
 * Options controlling how the function graph is built.
 * <p>
 * The defaults can be overridden with the environment variables
 * {@code FUNGRAPH_MAX_PROBE_DEPTH} and {@code FUNGRAPH_OPTIMIZE}.
 */
public final class GraphOptions {
    public static final int DEFAULT_MAX_PROBE_DEPTH = 1000;

    /**
     * The options read from the environment.
     */
    public static final GraphOptions DEFAULT = new GraphOptions(
            intFromEnv("FUNGRAPH_MAX_PROBE_DEPTH", DEFAULT_MAX_PROBE_DEPTH),
            !"false".equalsIgnoreCase(System.getenv("FUNGRAPH_OPTIMIZE")),
            true,
            false
    );

    private final int maxProbeDepth;
    private final boolean optimize;
    private final boolean cycleRepair;
    private final boolean strictScheduling;

    private GraphOptions(int maxProbeDepth, boolean optimize, boolean cycleRepair, boolean strictScheduling) {
        this.maxProbeDepth = maxProbeDepth;
        this.optimize = optimize;
        this.cycleRepair = cycleRepair;
        this.strictScheduling = strictScheduling;
    }

    private static int intFromEnv(String name, int dflt) {
        String value = System.getenv(name);
        if (value == null) return dflt;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    /**
     * The probe stack depth past which it is searched for a repeating segment.
     *
     * @return The depth.
     */
    public int getMaxProbeDepth() {
        return maxProbeDepth;
    }

    /**
     * Whether variant alternatives are specialized under their guards while being built.
     *
     * @return Whether to optimize.
     */
    public boolean isOptimize() {
        return optimize;
    }

    /**
     * Whether a variant whose guard refers to itself is repaired by specialization
     * before it is reported as a cycle.
     *
     * @return Whether to repair cycles.
     */
    public boolean isCycleRepair() {
        return cycleRepair;
    }

    /**
     * Whether scheduling-order violations are errors rather than warnings.
     *
     * @return Whether scheduling is strict.
     */
    public boolean isStrictScheduling() {
        return strictScheduling;
    }

    @Contract(pure = true)
    public GraphOptions withMaxProbeDepth(int maxProbeDepth) {
        if (maxProbeDepth < 2) throw new IllegalArgumentException("max probe depth must be at least 2");
        return new GraphOptions(maxProbeDepth, optimize, cycleRepair, strictScheduling);
    }

    @Contract(pure = true)
    public GraphOptions withOptimize(boolean optimize) {
        return new GraphOptions(maxProbeDepth, optimize, cycleRepair, strictScheduling);
    }

    @Contract(pure = true)
    public GraphOptions withCycleRepair(boolean cycleRepair) {
        return new GraphOptions(maxProbeDepth, optimize, cycleRepair, strictScheduling);
    }

    @Contract(pure = true)
    public GraphOptions withStrictScheduling(boolean strictScheduling) {
        return new GraphOptions(maxProbeDepth, optimize, cycleRepair, strictScheduling);
    }

    @Override
    public String toString() {
        return "GraphOptions{maxProbeDepth=" + maxProbeDepth
                + ", optimize=" + optimize
                + ", cycleRepair=" + cycleRepair
                + ", strictScheduling=" + strictScheduling + "}";
    }
}
