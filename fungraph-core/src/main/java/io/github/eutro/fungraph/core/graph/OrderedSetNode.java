package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.types.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code o(e1, e2, ...)}: the concatenation of its elements.
 */
public class OrderedSetNode extends SetConstructionNode {
    public OrderedSetNode(GraphContext ctx, List<FunctionNode> elements) {
        super(ctx, elements, typeOf(elements));
    }

    private static ValueType typeOf(List<FunctionNode> elements) {
        ValueType vt = ValueType.UNDEFINED;
        int min = 0;
        long max = 0;
        for (FunctionNode e : elements) {
            ValueType et = e.resolve().getValueType();
            vt = vt.merge(et);
            if (et.isUnknown()) {
                max = ValueType.UNBOUNDED;
            } else {
                min += et.getMinSize();
                max = Math.min((long) ValueType.UNBOUNDED, max + et.getMaxSize());
            }
        }
        return vt.withSize(min, (int) max);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ORDERED_SET;
    }

    @Override
    protected boolean isOrderSensitive() {
        return true;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new OrderedSetNode(ctx, inputs);
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        if (elements.size() == 1) return elements.get(0);
        List<Object> values = constantElements();
        if (values == null) return this;
        List<Object> flat = new ArrayList<>();
        for (Object v : values) {
            if (v instanceof List) {
                flat.addAll((List<?>) v);
            } else {
                flat.add(v);
            }
        }
        return new ConstNode(ctx, flat);
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return elements.size() == 1 ? getInputs() : super.getWriteThroughInputs();
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        if (elements.size() != 1) return null;
        return elements.get(0).extractWritableDestinations(ctx, path, visited);
    }
}
