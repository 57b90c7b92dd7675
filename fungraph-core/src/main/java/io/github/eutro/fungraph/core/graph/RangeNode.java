package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.types.RangeValue;
import io.github.eutro.fungraph.core.types.ValueType;

import java.util.*;

/**
 * {@code r(low, high)}, with open or closed bounds. The order of the bounds does not matter.
 */
public class RangeNode extends SetConstructionNode {
    private final boolean closedLower;
    private final boolean closedUpper;

    public RangeNode(GraphContext ctx, List<FunctionNode> bounds, boolean closedLower, boolean closedUpper) {
        super(ctx, bounds, ValueType.single(ValueType.Base.RANGE));
        this.closedLower = closedLower;
        this.closedUpper = closedUpper;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RANGE;
    }

    @Override
    protected boolean isOrderSensitive() {
        // a half-open range keeps its open end with its bound
        return closedLower != closedUpper;
    }

    @Override
    protected boolean paramsEqual(SetConstructionNode other) {
        RangeNode o = (RangeNode) other;
        return closedLower == o.closedLower && closedUpper == o.closedUpper;
    }

    @Override
    protected List<String> exportParams() {
        return Arrays.asList(String.valueOf(closedLower), String.valueOf(closedUpper));
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new RangeNode(ctx, inputs, closedLower, closedUpper);
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        List<Object> values = constantElements();
        if (values == null || values.size() != 2) return this;
        Object a = values.get(0);
        Object b = values.get(1);
        if (!(a instanceof Comparable) || !(b instanceof Comparable) || a.getClass() != b.getClass()) return this;
        return new ConstNode(ctx, new RangeValue((Comparable<?>) a, (Comparable<?>) b, closedLower, closedUpper));
    }
}
