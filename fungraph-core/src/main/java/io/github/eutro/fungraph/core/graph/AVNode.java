package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * Constructs an attribute-value object from one node per attribute.
 */
public class AVNode extends FunctionNode {
    private final SortedMap<String, FunctionNode> attributes;

    public AVNode(GraphContext ctx, SortedMap<String, FunctionNode> attributes) {
        super(ctx, scopeOf(ctx, Scope.GLOBAL, attributes.values()), typeOf(attributes));
        this.attributes = new TreeMap<>(attributes);
    }

    private static ValueType typeOf(Map<String, FunctionNode> attributes) {
        ValueType vt = ValueType.UNDEFINED.add(ValueType.Base.OBJECT).withSize(1, 1);
        for (Map.Entry<String, FunctionNode> e : attributes.entrySet()) {
            vt = vt.addAttribute(e.getKey(), e.getValue().resolve().getValueType());
        }
        return vt;
    }

    public SortedMap<String, FunctionNode> getAttributes() {
        return Collections.unmodifiableSortedMap(attributes);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AV;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return new ArrayList<>(attributes.values());
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        attributes.replaceAll((k, v) -> f.apply(v));
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        AVNode o = (AVNode) other;
        if (!attributes.keySet().equals(o.attributes.keySet())) return false;
        for (Map.Entry<String, FunctionNode> e : attributes.entrySet()) {
            if (e.getValue() != o.attributes.get(e.getKey())) return false;
        }
        return true;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        SortedMap<String, FunctionNode> na = new TreeMap<>();
        Iterator<FunctionNode> it = inputs.iterator();
        for (String k : attributes.keySet()) na.put(k, it.next());
        return new AVNode(ctx, na);
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        SortedMap<String, Object> values = new TreeMap<>();
        for (Map.Entry<String, FunctionNode> e : attributes.entrySet()) {
            FunctionNode v = e.getValue().resolve();
            if (!(v instanceof ConstNode) || !((ConstNode) v).wontChangeValue()) return this;
            values.put(e.getKey(), ((ConstNode) v).getValue());
        }
        return new ConstNode(ctx, values);
    }

    @Override
    public boolean isUnmergeable() {
        return false;
    }

    @Override
    public boolean isAlwaysTrue() {
        return true;
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return getInputs();
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        if (path.isEmpty()) return null;
        FunctionNode child = attributes.get(path.get(0));
        if (child == null) return null;
        return child.extractWritableDestinations(ctx, path.subList(1, path.size()), visited);
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>();
        for (Map.Entry<String, FunctionNode> e : attributes.entrySet()) {
            args.add('"' + e.getKey() + '"');
            args.add(ref.apply(e.getValue()));
        }
        return args;
    }

    @Override
    public String shape() {
        return super.shape() + attributes.keySet();
    }
}
