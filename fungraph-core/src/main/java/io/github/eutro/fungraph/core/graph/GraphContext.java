package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.build.WriteAction;
import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.diag.*;
import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.graph.display.GraphPrinter;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The state of one graph construction: the per-scope caches, the sequence and generation
 * counters, the probe stack and where diagnostics go.
 * <p>
 * Nothing here is global, so independent graphs can be built side by side.
 */
public class GraphContext {
    private static final Logger logger = LogManager.getLogger();

    private final GraphOptions options;
    private final TemplateTree templates;
    private final Diagnostics diagnostics;
    private final ProbeStack probes;

    private int seqCounter = 0;
    private int generation = 0;
    private final Map<Scope, NodeCache> caches = new HashMap<>();
    private final Set<FunctionNode> picking = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<FunctionNode> roots = new ArrayList<>();
    private final List<WriteAction> writes = new ArrayList<>();

    public GraphContext(GraphOptions options, TemplateTree templates, Diagnostics diagnostics) {
        this.options = options;
        this.templates = templates;
        this.diagnostics = diagnostics;
        this.probes = new ProbeStack(options.getMaxProbeDepth());
    }

    public GraphContext(GraphOptions options, TemplateTree templates) {
        this(options, templates, new Diagnostics());
    }

    public GraphOptions getOptions() {
        return options;
    }

    public TemplateTree getTemplates() {
        return templates;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public ProbeStack getProbes() {
        return probes;
    }

    int nextSeqNr() {
        return seqCounter++;
    }

    public int getGeneration() {
        return generation;
    }

    /**
     * Start a new generation, invalidating per-pass flags such as write reachability.
     *
     * @return The new generation.
     */
    public int nextGeneration() {
        return ++generation;
    }

    /**
     * Merge two scopes, reporting the current construct if they do not nest.
     *
     * @param a A scope.
     * @param b Another scope.
     * @return The innermost of the two.
     */
    public Scope mergeScopes(Scope a, Scope b) {
        return templates.merge(a, b, probes.currentConstruct());
    }

    @NotNull
    public NodeCache getCache(Scope scope) {
        return caches.computeIfAbsent(scope, NodeCache::new);
    }

    /**
     * The caches in export order: global scope first, then by template, closures after their template.
     *
     * @return The caches.
     */
    public List<NodeCache> getCaches() {
        List<NodeCache> ordered = new ArrayList<>(caches.values());
        ordered.sort(Comparator.<NodeCache>comparingInt(c -> c.getScope().template)
                .thenComparingInt(c -> c.getScope().closure));
        return ordered;
    }

    public void addRoot(FunctionNode root) {
        roots.add(root);
    }

    public List<FunctionNode> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public void addWrite(WriteAction write) {
        writes.add(write);
    }

    public List<WriteAction> getWrites() {
        return Collections.unmodifiableList(writes);
    }

    boolean enterPick(FunctionNode node) {
        return picking.add(node);
    }

    void exitPick(FunctionNode node) {
        picking.remove(node);
    }

    /**
     * Internalize a node, failing if it cannot be cached yet.
     *
     * @param node The node.
     * @return The cached node.
     * @throws CycleException If the node depends on itself, or on an unresolved forward reference.
     */
    @NotNull
    public FunctionNode cache(FunctionNode node) {
        CacheResult result = internalize(node);
        if (result.isCached()) return result.getNode();
        throw new CycleException(constructOf(node), result.getSignal().trace);
    }

    /**
     * Hash-cons a node and its inputs into the caches of their scopes.
     * <p>
     * Inputs are internalized first and replaced by their cached versions. If an equal node is already
     * cached, that node is returned; otherwise the node is added and scheduled.
     * <p>
     * A cycle through a variant that may still be repaired is not an error: a {@link CycleSignal}
     * unwinds to that variant's internalization, which replaces the variant with its alternatives
     * specialized under their guards and retries once.
     *
     * @param node The node.
     * @return The cached node, or a signal if it could not be cached yet.
     */
    public CacheResult internalize(FunctionNode node) {
        FunctionNode n = node.resolve();
        if (n.id >= 0) return CacheResult.of(n);
        switch (n.id) {
            case FunctionNode.PROBING:
                return cycleAt(n);
            case FunctionNode.UNRESOLVED_REFERENCE:
                return CacheResult.pending(new CycleSignal(n.getSeqNr(), probes.traceFrom(n)));
            case FunctionNode.CYCLE_SENTINEL:
                throw new CycleException(constructOf(n), probes.traceFrom(n));
            case FunctionNode.COMPACTED:
                throw new IllegalStateException(n + " was compacted away");
            default:
                break;
        }

        probes.push(n);
        n.id = FunctionNode.PROBING;
        try {
            Map<FunctionNode, FunctionNode> cached = new IdentityHashMap<>();
            for (FunctionNode input : n.getInputs()) {
                if (cached.containsKey(input)) continue;
                CacheResult r = internalize(input);
                if (!r.isCached()) {
                    n.id = FunctionNode.UNCACHED;
                    return repairOrPropagate(n, r.getSignal());
                }
                cached.put(input, r.getNode());
            }
            n.replaceInputs(input -> cached.getOrDefault(input, input));

            Scope scope = n.scope;
            int watermark = -1;
            for (FunctionNode input : n.getInputs()) {
                scope = mergeScopes(scope, input.scope);
            }
            for (FunctionNode input : n.getInputs()) {
                if (input.scope.equals(scope)) watermark = Math.max(watermark, input.id);
            }
            n.scope = scope;

            NodeCache cache = getCache(scope);
            FunctionNode existing = cache.find(n, watermark);
            if (existing != null) {
                n.id = FunctionNode.UNCACHED;
                checkConsistent(existing, n);
                if (n.priority > existing.priority) widenPriority(existing, n.priority);
                n.setReplacement(existing);
                return CacheResult.of(existing);
            }
            cache.add(n);
            schedule(n);
            return CacheResult.of(n);
        } finally {
            probes.pop();
            if (n.id == FunctionNode.PROBING) n.id = FunctionNode.UNCACHED;
        }
    }

    private CacheResult cycleAt(FunctionNode head) {
        VariantNode repairable = probes.findRepairable(head);
        if (repairable != null) {
            logger.debug("cycle through {}, signalling {}", head, repairable);
            return CacheResult.pending(new CycleSignal(repairable.getSeqNr(), probes.traceFrom(head)));
        }
        throw new CycleException(constructOf(head), probes.traceFrom(head));
    }

    private CacheResult repairOrPropagate(FunctionNode n, CycleSignal signal) {
        if (signal.seqNr != n.getSeqNr() || !(n instanceof VariantNode)) {
            return CacheResult.pending(signal);
        }
        VariantNode variant = (VariantNode) n;
        logger.debug("repairing cycle at {}:\n  {}", variant, String.join("\n  ", signal.trace));
        VariantNode repaired = variant.repair(this);
        variant.setReplacement(repaired);
        CacheResult retried = internalize(repaired);
        if (!retried.isCached() && retried.getSignal().seqNr == repaired.getSeqNr()) {
            if (logger.isDebugEnabled()) {
                logger.debug("repair failed:\n{}", new GraphPrinter(this, 4).print(repaired));
            }
            throw new CycleException(constructOf(variant), retried.getSignal().trace);
        }
        return retried;
    }

    private void checkConsistent(FunctionNode existing, FunctionNode n) {
        if (existing.valueType.isEqualOrUnknown(n.valueType) || existing.valueType.subsumes(n.valueType)) {
            return;
        }
        if (n.valueType.subsumes(existing.valueType)) {
            // the equal node saw more of the graph, e.g. an export defined after a projection of it
            logger.debug("widening {} from {} to {}", existing, existing.valueType, n.valueType);
            existing.widenValueType(n.valueType);
            return;
        }
        throw new InconsistentCacheException("cached " + existing + " has type " + existing.valueType
                + " but an equal node has type " + n.valueType, constructOf(n));
    }

    private void schedule(FunctionNode n) {
        if (n.isConstant()) {
            n.scheduleStep = 0;
            return;
        }
        for (FunctionNode input : n.getInputs()) {
            widenPriority(input, n.priority);
        }
        n.scheduleStep = computeStep(n);
        for (FunctionNode input : n.getInputs()) {
            if (!n.isScheduledProperly(input)) {
                reportSchedulingError(n, input);
                break;
            }
        }
    }

    private static int computeStep(FunctionNode n) {
        int step = 0;
        for (FunctionNode input : n.getInputs()) {
            if (input.priority == n.priority && !input.isConstant()) {
                step = Math.max(step, input.scheduleStep + 1);
            }
        }
        return step;
    }

    private static void widenPriority(FunctionNode n, int priority) {
        if (n.priority >= priority || n.isPriorityFixed()) return;
        n.priority = priority;
        for (FunctionNode input : n.getInputs()) {
            widenPriority(input, priority);
        }
        n.scheduleStep = computeStep(n);
    }

    private void reportSchedulingError(FunctionNode n, FunctionNode input) {
        markSchedulingError(n);
        Diagnostic d = new Diagnostic(Diagnostic.Kind.SCHEDULING_ORDER,
                options.isStrictScheduling() ? Diagnostic.Severity.ERROR : Diagnostic.Severity.WARNING,
                input + " (priority " + input.priority + ") is not evaluated before " + n
                        + " (priority " + n.priority + ")",
                constructOf(n));
        if (d.isFatal()) throw new CompilationException(d);
        diagnostics.report(d);
    }

    private static void markSchedulingError(FunctionNode n) {
        if (n.schedulingError) return;
        n.schedulingError = true;
        for (FunctionNode input : n.getInputs()) {
            markSchedulingError(input);
        }
    }

    /**
     * The source construct a node was built for, falling back to the innermost construct being built.
     *
     * @param node The node.
     * @return The construct.
     */
    @Nullable
    public String constructOf(FunctionNode node) {
        String origin = node.getNullable(GraphExts.ORIGIN);
        return origin != null ? origin : probes.currentConstruct();
    }

    /**
     * Report an unsupported write target once per construct.
     *
     * @param message   What is unsupported.
     * @param construct Where.
     */
    public void warnUnsupportedWrite(String message, @Nullable String construct) {
        diagnostics.warnOnce(Diagnostic.Kind.UNSUPPORTED_WRITE_TARGET, message, construct);
    }

    public int size() {
        int size = 0;
        for (NodeCache cache : caches.values()) size += cache.size();
        return size;
    }
}
