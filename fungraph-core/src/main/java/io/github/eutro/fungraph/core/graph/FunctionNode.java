package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.ext.ExtHolder;
import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A node in the function graph.
 * <p>
 * Nodes are created uncached, and become part of the graph when {@link GraphContext#internalize(FunctionNode) internalized},
 * which assigns their {@link #getId() id} in their scope's {@link NodeCache}, replaces their inputs with the cached
 * equivalents and computes their schedule. Once cached, a node is only ever mutated to widen its priority or value type
 * and to record write reachability.
 * <p>
 * Negative ids are sentinels for nodes that are not (or not yet) in a cache.
 */
public abstract class FunctionNode extends ExtHolder {
    /**
     * Not yet internalized.
     */
    public static final int UNCACHED = -1;
    /**
     * Removed by {@link io.github.eutro.fungraph.core.passes.opts.CompactGraph}.
     */
    public static final int COMPACTED = -2;
    /**
     * A forward reference whose target is not known yet.
     */
    public static final int UNRESOLVED_REFERENCE = -3;
    /**
     * A forward reference that has been resolved; use {@link #resolve()}.
     */
    public static final int RESOLVED_REFERENCE = -4;
    /**
     * The cycle sentinel.
     */
    public static final int CYCLE_SENTINEL = -5;
    /**
     * Currently being internalized; meeting a node with this id again means a cycle.
     */
    public static final int PROBING = -6;

    public static final int PRIORITY_DEFAULT = 0;
    /**
     * The priority of nodes holding external input (message queues, pointer state),
     * which must be settled before anything at the default priority.
     */
    public static final int PRIORITY_INPUT = 1;

    private final int seqNr;
    int id = UNCACHED;
    @NotNull
    Scope scope;
    int scheduleStep = -1;
    int priority;
    @NotNull
    ValueType valueType;
    @Nullable
    private FunctionNode replacement;

    int writableGeneration = -1;
    int queuedGeneration = -1;
    int writeOutputGeneration = -1;
    boolean schedulingError;

    protected FunctionNode(@NotNull GraphContext ctx, @NotNull Scope scope, @NotNull ValueType valueType, int priority) {
        this.seqNr = ctx.nextSeqNr();
        this.scope = scope;
        this.valueType = valueType;
        this.priority = priority;
    }

    protected FunctionNode(@NotNull GraphContext ctx, @NotNull Scope scope, @NotNull ValueType valueType) {
        this(ctx, scope, valueType, PRIORITY_DEFAULT);
    }

    /**
     * The innermost scope enclosing {@code base} and the scopes of all inputs.
     *
     * @param ctx    The graph context.
     * @param base   The scope the node has on its own.
     * @param inputs The inputs.
     * @return The merged scope.
     */
    protected static Scope scopeOf(GraphContext ctx, Scope base, Collection<? extends FunctionNode> inputs) {
        Scope s = base;
        for (FunctionNode input : inputs) {
            if (input != null) s = ctx.mergeScopes(s, input.resolve().scope);
        }
        return s;
    }

    public abstract NodeKind getKind();

    /**
     * The inputs of this node, in a fixed order per kind.
     *
     * @return The inputs.
     */
    public abstract List<FunctionNode> getInputs();

    /**
     * Replace every input with the result of {@code f}.
     *
     * @param f The replacement function.
     */
    protected abstract void replaceInputs(F<FunctionNode, FunctionNode> f);

    /**
     * Kind-specific structural equality. {@code other} is of the same class and scope,
     * and the inputs of both are already cached, so inputs compare by identity.
     *
     * @param other The other node.
     * @return Whether the nodes compute the same value.
     */
    protected abstract boolean contentEquals(FunctionNode other);

    /**
     * A fresh, uncached copy of this node with different inputs.
     *
     * @param ctx    The graph context.
     * @param inputs The new inputs, parallel to {@link #getInputs()}.
     * @return The copy.
     */
    protected abstract FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs);

    /**
     * The arguments of this node in the export form.
     *
     * @param ref Renders a reference to an input.
     * @return The arguments.
     */
    public abstract List<String> exportArguments(F<FunctionNode, String> ref);

    /**
     * Fold this node into a simpler equivalent, if its inputs allow it.
     *
     * @param ctx The graph context.
     * @return The simpler node, or this.
     */
    public FunctionNode simplify(GraphContext ctx) {
        return this;
    }

    /**
     * Whether this node and {@code other} are interchangeable.
     *
     * @param other The other node.
     * @return Whether the nodes are equal.
     */
    public boolean isEqual(FunctionNode other) {
        if (this == other) return true;
        if (id >= 0 && other.id >= 0) return false;
        return getClass() == other.getClass()
                && scope.equals(other.scope)
                && contentEquals(other);
    }

    /**
     * Follow forward references and replacements to the node standing for this one.
     *
     * @return The node.
     */
    @NotNull
    public FunctionNode resolve() {
        FunctionNode n = this;
        while (n.replacement != null) n = n.replacement;
        return n;
    }

    void setReplacement(@NotNull FunctionNode replacement) {
        if (replacement.resolve() != this) {
            this.replacement = replacement;
        }
    }

    public boolean isConstant() {
        return false;
    }

    /**
     * Whether priority widening must not raise this node's priority.
     *
     * @return Whether the priority is fixed.
     */
    public boolean isPriorityFixed() {
        return isConstant();
    }

    /**
     * Whether a value of this node wins outright against later alternatives of a variant,
     * rather than being merged with them.
     *
     * @return Whether the value is unmergeable.
     */
    public boolean isUnmergeable() {
        return !valueType.isPotentiallyMergeable();
    }

    public boolean isAlwaysTrue() {
        return false;
    }

    public boolean isAlwaysFalse() {
        return false;
    }

    /**
     * The inputs through which a write to this node may pass on to storage.
     *
     * @return The inputs.
     */
    public List<FunctionNode> getWriteThroughInputs() {
        return Collections.emptyList();
    }

    /**
     * Whether {@code input} is guaranteed to be evaluated before this node.
     *
     * @param input An input of this node.
     * @return Whether the order is correct.
     */
    public boolean isScheduledProperly(FunctionNode input) {
        return input.isConstant()
                || input.priority > priority
                || input.priority == priority && input.scheduleStep < scheduleStep;
    }

    /**
     * Walk down from a write's target to the storage it ultimately lands on.
     *
     * @param ctx     The graph context.
     * @param path    The attribute path written below this node.
     * @param visited The nodes on the current walk.
     * @return The destinations, or null if the write cannot be lowered.
     */
    @Nullable
    public final List<WritableDestination> extractWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        FunctionNode self = resolve();
        if (self != this) return self.extractWritableDestinations(ctx, path, visited);
        if (!visited.add(this)) return Collections.emptyList();
        try {
            List<WritableDestination> dests = collectWritableDestinations(ctx, path, visited);
            if (dests != null) writeOutputGeneration = ctx.getGeneration();
            return dests;
        } finally {
            visited.remove(this);
        }
    }

    @Nullable
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        return null;
    }

    /**
     * Specialize this node for a context in which {@code known} holds.
     * <p>
     * Only inputs in this node's own scope are specialized, since the qualifiers are not known to hold elsewhere.
     * The result may be uncached; shared nodes are never modified.
     *
     * @param ctx   The graph context.
     * @param known What is known.
     * @return An equivalent node under {@code known}, or this.
     */
    public FunctionNode pickQualifiedExpression(GraphContext ctx, KnownQualifiers known) {
        FunctionNode self = resolve();
        if (self != this) return self.pickQualifiedExpression(ctx, known);
        if (known.isEmpty()) return this;
        Optional<Object> knownValue = known.knownValue(this);
        if (knownValue.isPresent()
                && (!(knownValue.get() instanceof Boolean) || valueType.isStrictlyBoolean())) {
            return new ConstNode(ctx, knownValue.get());
        }
        if (getInputs().isEmpty()) return this;
        Map<KnownQualifiers, FunctionNode> memo = id >= 0
                ? getExtOrCompute(GraphExts.SPECIALIZATIONS, HashMap::new)
                : null;
        if (memo != null) {
            FunctionNode cached = memo.get(known);
            if (cached != null) return cached;
        }
        if (!ctx.enterPick(this)) return this;
        FunctionNode picked;
        try {
            picked = specialize(ctx, known);
        } finally {
            ctx.exitPick(this);
        }
        if (memo != null) memo.put(known, picked);
        return picked;
    }

    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        List<FunctionNode> inputs = getInputs();
        List<FunctionNode> picked = new ArrayList<>(inputs.size());
        boolean changed = false;
        for (FunctionNode input : inputs) {
            FunctionNode p = isLocal(input) ? input.pickQualifiedExpression(ctx, known) : input;
            changed |= p != input;
            picked.add(p);
        }
        return changed ? withInputs(ctx, picked).simplify(ctx) : this;
    }

    /**
     * Whether {@code input} shares this node's scope and closure.
     *
     * @param input The input.
     * @return Whether specialization may descend into it.
     */
    protected boolean isLocal(FunctionNode input) {
        return input.resolve().scope.equals(scope);
    }

    public int getSeqNr() {
        return seqNr;
    }

    public int getId() {
        return id;
    }

    public boolean isCached() {
        return id >= 0;
    }

    @NotNull
    public Scope getScope() {
        return scope;
    }

    public int getScheduleStep() {
        return scheduleStep;
    }

    public int getPriority() {
        return priority;
    }

    @NotNull
    public ValueType getValueType() {
        return valueType;
    }

    /**
     * Widen the value type to include {@code type}.
     *
     * @param type The type to include.
     */
    public void widenValueType(ValueType type) {
        valueType = valueType.merge(type);
    }

    public boolean isWritable(GraphContext ctx) {
        return writableGeneration == ctx.getGeneration();
    }

    /**
     * Mark this node as reachable from a storage leaf in the current generation.
     *
     * @param ctx The graph context.
     */
    public void markWritable(GraphContext ctx) {
        writableGeneration = ctx.getGeneration();
    }

    /**
     * Mark this node as queued for the writability walk of the current generation.
     *
     * @param ctx The graph context.
     * @return Whether it was not queued yet.
     */
    public boolean markQueued(GraphContext ctx) {
        if (queuedGeneration == ctx.getGeneration()) return false;
        queuedGeneration = ctx.getGeneration();
        return true;
    }

    /**
     * Whether a write lowered in the current generation passes through this node.
     *
     * @param ctx The graph context.
     * @return Whether this node is on a write's output path.
     */
    public boolean isOnWriteOutputPath(GraphContext ctx) {
        return writeOutputGeneration == ctx.getGeneration();
    }

    public boolean hasSchedulingError() {
        return schedulingError;
    }

    /**
     * A short description, without sequence numbers, used to find repetitions on the probe stack.
     *
     * @return The description.
     */
    public String shape() {
        return getKind() + "" + scope;
    }

    @Override
    public String toString() {
        return getKind() + "#" + seqNr + (id >= 0 ? "=" + id : "") + scope;
    }
}
