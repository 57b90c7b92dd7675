package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.qual.TriState;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * {@code value} if {@code condition} is true, otherwise {@code o()}.
 */
public class BoolGateNode extends FunctionNode {
    private FunctionNode condition;
    private FunctionNode value;

    public BoolGateNode(GraphContext ctx, FunctionNode condition, FunctionNode value) {
        super(ctx, scopeOf(ctx, Scope.GLOBAL, Arrays.asList(condition, value)),
                value.resolve().getValueType().addSize(0, 0));
        this.condition = condition;
        this.value = value;
    }

    public FunctionNode getCondition() {
        return condition;
    }

    public FunctionNode getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOL_GATE;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return Arrays.asList(condition, value);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        condition = f.apply(condition);
        value = f.apply(value);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        BoolGateNode o = (BoolGateNode) other;
        return condition == o.condition && value == o.value;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new BoolGateNode(ctx, inputs.get(0), inputs.get(1));
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        FunctionNode c = condition.resolve();
        if (c.isAlwaysTrue()) return value;
        if (c.isAlwaysFalse()) return new ConstNode(ctx, Collections.emptyList());
        return this;
    }

    @Override
    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        TriState state = known.evaluate(SingleQualifier.onNode(condition.resolve(), true));
        if (state == TriState.TRUE) {
            return isLocal(value) ? value.pickQualifiedExpression(ctx, known) : value;
        }
        if (state == TriState.FALSE) return new ConstNode(ctx, Collections.emptyList());
        return super.specialize(ctx, known);
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return Collections.singletonList(value);
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        List<WritableDestination> dests = value.extractWritableDestinations(ctx, path, visited);
        return dests == null ? null
                : guarded(dests, Conjunction.of(SingleQualifier.onNode(condition.resolve(), true)));
    }

    /**
     * Restrict destinations to a guard, dropping those that become impossible.
     *
     * @param dests The destinations.
     * @param guard The guard.
     * @return The guarded destinations.
     */
    static List<WritableDestination> guarded(List<WritableDestination> dests, Conjunction guard) {
        List<WritableDestination> out = new ArrayList<>(dests.size());
        for (WritableDestination d : dests) {
            Conjunction g = guard.and(d.guard);
            if (g != null) out.add(new WritableDestination(d.storage, d.path, g));
        }
        return out;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        return Arrays.asList(ref.apply(condition), ref.apply(value));
    }
}
