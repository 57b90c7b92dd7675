package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.types.ValueType;

import java.util.List;

/**
 * {@code s(e1, e2, ...)}: matches strings containing any of its elements.
 */
public class SubStringNode extends SetConstructionNode {
    public SubStringNode(GraphContext ctx, List<FunctionNode> elements) {
        super(ctx, elements, ValueType.single(ValueType.Base.ANY_DATA));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUB_STRING;
    }

    @Override
    protected boolean isOrderSensitive() {
        return false;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new SubStringNode(ctx, inputs);
    }
}
