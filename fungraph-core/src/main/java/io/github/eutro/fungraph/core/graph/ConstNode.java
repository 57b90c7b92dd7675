package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.Projector;
import io.github.eutro.fungraph.core.types.RangeValue;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * A constant value. Constants live in the global scope and are always scheduled first.
 * <p>
 * Values are {@link Boolean}s, {@link Double}s, {@link String}s, {@link RangeValue}s, the {@link Projector},
 * {@link List}s (ordered sets) and {@link Map}s (attribute-value objects) of these. The empty list is {@code o()}.
 */
public class ConstNode extends FunctionNode {
    private final Object value;
    private final boolean wontChangeValue;

    public ConstNode(GraphContext ctx, Object value, boolean wontChangeValue) {
        super(ctx, Scope.GLOBAL, ValueType.fromConstant(normalize(value)));
        this.value = normalize(value);
        this.wontChangeValue = wontChangeValue;
    }

    public ConstNode(GraphContext ctx, Object value) {
        this(ctx, value, true);
    }

    /**
     * Numbers become doubles, single-element lists their element, and null {@code o()}.
     *
     * @param value The value.
     * @return The normal form.
     */
    static Object normalize(Object value) {
        if (value == null) return Collections.emptyList();
        if (value instanceof Number && !(value instanceof Double)) return ((Number) value).doubleValue();
        if (value instanceof List) {
            List<?> ls = (List<?>) value;
            if (ls.size() == 1) return normalize(ls.get(0));
            List<Object> nl = new ArrayList<>(ls.size());
            for (Object o : ls) nl.add(normalize(o));
            return Collections.unmodifiableList(nl);
        }
        if (value instanceof Map) {
            SortedMap<String, Object> nm = new TreeMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                nm.put(String.valueOf(e.getKey()), normalize(e.getValue()));
            }
            return Collections.unmodifiableSortedMap(nm);
        }
        return value;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Whether this constant is final, as opposed to the initial value of something that changes.
     *
     * @return Whether the value never changes.
     */
    public boolean wontChangeValue() {
        return wontChangeValue;
    }

    public boolean isUndefined() {
        return value instanceof List && ((List<?>) value).isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONST;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return Collections.emptyList();
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        ConstNode o = (ConstNode) other;
        return wontChangeValue == o.wontChangeValue && value.equals(o.value);
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return this;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public boolean isUnmergeable() {
        return !(value instanceof Map) && !isUndefined();
    }

    @Override
    public boolean isAlwaysTrue() {
        return SingleQualifier.isTrue(value);
    }

    @Override
    public boolean isAlwaysFalse() {
        return !SingleQualifier.isTrue(value);
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        return Collections.singletonList(render(value));
    }

    /**
     * Render a constant value in the export form.
     *
     * @param value The value.
     * @return The rendering.
     */
    public static String render(Object value) {
        if (value instanceof String) {
            return '"' + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        } else if (value instanceof Double) {
            double d = (Double) value;
            return d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf((long) d) : String.valueOf(d);
        } else if (value instanceof List) {
            StringJoiner sj = new StringJoiner(", ", "o(", ")");
            for (Object o : (List<?>) value) sj.add(render(o));
            return sj.toString();
        } else if (value instanceof Map) {
            StringJoiner sj = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                sj.add(e.getKey() + ": " + render(e.getValue()));
            }
            return sj.toString();
        }
        return String.valueOf(value);
    }

    @Override
    public String shape() {
        return super.shape() + render(value);
    }

    @Override
    public String toString() {
        return super.toString() + "(" + render(value) + ")";
    }
}
