package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.types.ValueType;

import java.util.List;

/**
 * {@code n(e1, e2, ...)}: matches anything except its elements.
 */
public class NegationNode extends SetConstructionNode {
    public NegationNode(GraphContext ctx, List<FunctionNode> elements) {
        super(ctx, elements, ValueType.single(ValueType.Base.ANY_DATA));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NEGATION;
    }

    @Override
    protected boolean isOrderSensitive() {
        return false;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new NegationNode(ctx, inputs);
    }
}
