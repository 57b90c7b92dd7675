package io.github.eutro.fungraph.core.graph;

import java.util.*;

/**
 * Sorts an ordered set of objects by the value at a key path.
 */
public class SortNode extends FunctionApplicationNode {
    private final List<String> keyPath;
    private final boolean ascending;

    public SortNode(GraphContext ctx, FunctionNode data, List<String> keyPath, boolean ascending) {
        super(ctx, BuiltInFunctions.SORT, Collections.singletonList(data));
        this.keyPath = Collections.unmodifiableList(new ArrayList<>(keyPath));
        this.ascending = ascending;
    }

    public List<String> getKeyPath() {
        return keyPath;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SORT;
    }

    @Override
    protected boolean paramsEqual(FunctionApplicationNode other) {
        SortNode o = (SortNode) other;
        return ascending == o.ascending && keyPath.equals(o.keyPath);
    }

    @Override
    protected List<String> exportParams() {
        return Arrays.asList('"' + String.join(".", keyPath) + '"', ascending ? "ascending" : "descending");
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new SortNode(ctx, inputs.get(0), keyPath, ascending);
    }
}
