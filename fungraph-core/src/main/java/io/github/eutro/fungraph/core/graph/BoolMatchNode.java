package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.qual.TriState;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * {@code result} if {@code value} matches {@code pattern}, otherwise {@code o()}.
 */
public class BoolMatchNode extends FunctionNode {
    private FunctionNode value;
    private FunctionNode pattern;
    private FunctionNode result;

    public BoolMatchNode(GraphContext ctx, FunctionNode value, FunctionNode pattern, FunctionNode result) {
        super(ctx, scopeOf(ctx, Scope.GLOBAL, Arrays.asList(value, pattern, result)),
                result.resolve().getValueType().addSize(0, 0));
        this.value = value;
        this.pattern = pattern;
        this.result = result;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOL_MATCH;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return Arrays.asList(value, pattern, result);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        value = f.apply(value);
        pattern = f.apply(pattern);
        result = f.apply(result);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        BoolMatchNode o = (BoolMatchNode) other;
        return value == o.value && pattern == o.pattern && result == o.result;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new BoolMatchNode(ctx, inputs.get(0), inputs.get(1), inputs.get(2));
    }

    private SingleQualifier matchQualifier() {
        FunctionNode p = pattern.resolve();
        return p instanceof ConstNode ? SingleQualifier.onNode(value.resolve(), ((ConstNode) p).getValue()) : null;
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        FunctionNode v = value.resolve();
        FunctionNode p = pattern.resolve();
        if (v instanceof ConstNode && p instanceof ConstNode && ((ConstNode) v).wontChangeValue()) {
            return SingleQualifier.matchesPattern(((ConstNode) p).getValue(), ((ConstNode) v).getValue())
                    ? result
                    : new ConstNode(ctx, Collections.emptyList());
        }
        return this;
    }

    @Override
    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        SingleQualifier q = matchQualifier();
        if (q != null) {
            TriState state = known.evaluate(q);
            if (state == TriState.TRUE) return isLocal(result) ? result.pickQualifiedExpression(ctx, known) : result;
            if (state == TriState.FALSE) return new ConstNode(ctx, Collections.emptyList());
        }
        return super.specialize(ctx, known);
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return Collections.singletonList(result);
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        SingleQualifier q = matchQualifier();
        if (q == null) return null;
        List<WritableDestination> dests = result.extractWritableDestinations(ctx, path, visited);
        return dests == null ? null : BoolGateNode.guarded(dests, Conjunction.of(q));
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        return Arrays.asList(ref.apply(value), ref.apply(pattern), ref.apply(result));
    }
}
