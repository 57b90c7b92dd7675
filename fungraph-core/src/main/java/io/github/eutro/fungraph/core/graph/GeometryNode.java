package io.github.eutro.fungraph.core.graph;

import java.util.*;

/**
 * An area geometry function ({@code offset}, {@code overlap}) over the areas of some templates.
 * The templates take part in equality, since the same expression means different areas in different templates.
 */
public class GeometryNode extends FunctionApplicationNode {
    private final SortedSet<Integer> templates;

    public GeometryNode(GraphContext ctx, BuiltInFunction function, List<FunctionNode> args, SortedSet<Integer> templates) {
        super(ctx, function, args);
        if (function != BuiltInFunctions.OFFSET && function != BuiltInFunctions.OVERLAP) {
            throw new IllegalArgumentException(function + " is not a geometry function");
        }
        this.templates = Collections.unmodifiableSortedSet(new TreeSet<>(templates));
    }

    public SortedSet<Integer> getTemplates() {
        return templates;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GEOMETRY;
    }

    @Override
    protected boolean paramsEqual(FunctionApplicationNode other) {
        return templates.equals(((GeometryNode) other).templates);
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList(templates.toString().replace(" ", ""));
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new GeometryNode(ctx, function, inputs, templates);
    }
}
