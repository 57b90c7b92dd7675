package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * Projects the value at an attribute path out of data, {@code [{a: {b: _}}, data]}.
 * Writes pass through to the data, one level deeper per projected attribute.
 */
public class QueryApplicationNode extends FunctionApplicationNode {
    private final List<String> path;

    public QueryApplicationNode(GraphContext ctx, List<String> path, FunctionNode data) {
        super(ctx, BuiltInFunctions.INTERNAL_APPLY, Collections.singletonList(data));
        if (path.isEmpty()) throw new IllegalArgumentException("empty query path");
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        ValueType vt = data.resolve().getValueType();
        for (String attr : path) vt = vt.getAttribute(attr);
        this.valueType = vt;
    }

    public List<String> getPath() {
        return path;
    }

    public FunctionNode getData() {
        return args.get(0);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.QUERY_APPLICATION;
    }

    @Override
    protected boolean paramsEqual(FunctionApplicationNode other) {
        return path.equals(((QueryApplicationNode) other).path);
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList('"' + String.join(".", path) + '"');
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new QueryApplicationNode(ctx, path, inputs.get(0));
    }

    @Override
    public boolean isPure() {
        return true;
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        FunctionNode data = getData().resolve();
        if (data instanceof AVNode) {
            FunctionNode v = ((AVNode) data).getAttributes().get(path.get(0));
            if (v == null) return new ConstNode(ctx, Collections.emptyList());
            return path.size() == 1 ? v : new QueryApplicationNode(ctx, path.subList(1, path.size()), v).simplify(ctx);
        }
        if (data instanceof ConstNode && ((ConstNode) data).wontChangeValue()) {
            Object v = ((ConstNode) data).getValue();
            for (String attr : path) {
                v = v instanceof Map ? ((Map<?, ?>) v).get(attr) : null;
            }
            return new ConstNode(ctx, v);
        }
        return this;
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return Collections.singletonList(getData());
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        List<String> deeper = new ArrayList<>(this.path);
        deeper.addAll(path);
        return getData().extractWritableDestinations(ctx, deeper, visited);
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        return Arrays.asList('"' + String.join(".", path) + '"', ref.apply(getData()));
    }
}
