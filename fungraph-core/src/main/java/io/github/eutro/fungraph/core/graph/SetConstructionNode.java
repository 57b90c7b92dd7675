package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * Base class of the collection constructors {@code o()}, {@code r()}, {@code n()}, {@code s()} and {@code c()}.
 * <p>
 * Elements compare pairwise in order for order-sensitive kinds, and as a multiset otherwise.
 */
public abstract class SetConstructionNode extends FunctionNode {
    protected final List<FunctionNode> elements;

    protected SetConstructionNode(GraphContext ctx, List<FunctionNode> elements, ValueType valueType) {
        super(ctx, scopeOf(ctx, Scope.GLOBAL, elements), valueType);
        this.elements = new ArrayList<>(elements);
    }

    public List<FunctionNode> getElements() {
        return Collections.unmodifiableList(elements);
    }

    protected abstract boolean isOrderSensitive();

    protected boolean paramsEqual(SetConstructionNode other) {
        return true;
    }

    protected List<String> exportParams() {
        return Collections.emptyList();
    }

    @Override
    public List<FunctionNode> getInputs() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        elements.replaceAll(f::apply);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        SetConstructionNode o = (SetConstructionNode) other;
        if (elements.size() != o.elements.size() || !paramsEqual(o)) return false;
        if (isOrderSensitive()) {
            for (int i = 0; i < elements.size(); i++) {
                if (elements.get(i) != o.elements.get(i)) return false;
            }
            return true;
        }
        Map<FunctionNode, Integer> counts = new IdentityHashMap<>();
        for (FunctionNode e : elements) counts.merge(e, 1, Integer::sum);
        for (FunctionNode e : o.elements) {
            Integer c = counts.get(e);
            if (c == null || c == 0) return false;
            counts.put(e, c - 1);
        }
        return true;
    }

    /**
     * The constant values of all elements, if they are all final constants.
     *
     * @return The values, or null.
     */
    protected List<Object> constantElements() {
        List<Object> values = new ArrayList<>(elements.size());
        for (FunctionNode e : elements) {
            FunctionNode r = e.resolve();
            if (!(r instanceof ConstNode) || !((ConstNode) r).wontChangeValue()) return null;
            values.add(((ConstNode) r).getValue());
        }
        return values;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>(exportParams());
        for (FunctionNode e : elements) args.add(ref.apply(e));
        return args;
    }

    @Override
    public String shape() {
        return super.shape() + elements.size();
    }
}
