package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;

import java.util.*;

/**
 * {@code [{children: {name: _}}, areas]}: the child areas with the given name.
 */
public class ChildAreasNode extends AreaNavigationNode {
    private final String childName;

    public ChildAreasNode(GraphContext ctx, String childName, FunctionNode areas) {
        this(ctx, childName, areas, childTemplates(ctx, childName, areas));
    }

    private ChildAreasNode(GraphContext ctx, String childName, FunctionNode areas, SortedSet<Integer> children) {
        super(ctx, Scope.GLOBAL, areas, children, areasOf(children));
        this.childName = childName;
    }

    private static SortedSet<Integer> childTemplates(GraphContext ctx, String childName, FunctionNode areas) {
        SortedSet<Integer> children = new TreeSet<>();
        for (int t : areas.resolve().getValueType().getAreas()) {
            AreaTemplate child = ctx.getTemplates().getTemplate(t).getChild(childName);
            if (child != null) children.add(child.id);
        }
        return children;
    }

    public String getChildName() {
        return childName;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CHILD_AREAS;
    }

    @Override
    protected boolean paramsEqual(AreaNavigationNode other) {
        return childName.equals(((ChildAreasNode) other).childName);
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList('"' + childName + '"');
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new ChildAreasNode(ctx, childName, inputs.get(0));
    }
}
