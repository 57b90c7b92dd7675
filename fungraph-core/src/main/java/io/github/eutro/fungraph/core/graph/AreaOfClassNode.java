package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;

import java.util.*;

/**
 * {@code [areaOfClass, "name"]}: all areas that are members of a class.
 */
public class AreaOfClassNode extends AreaNavigationNode {
    private final String className;

    public AreaOfClassNode(GraphContext ctx, String className) {
        this(ctx, className, classTemplates(ctx, className));
    }

    private AreaOfClassNode(GraphContext ctx, String className, SortedSet<Integer> members) {
        super(ctx, Scope.GLOBAL, null, members, areasOf(members));
        this.className = className;
    }

    private static SortedSet<Integer> classTemplates(GraphContext ctx, String className) {
        SortedSet<Integer> members = new TreeSet<>();
        for (AreaTemplate t : ctx.getTemplates().getTemplates()) {
            if (t.getClassMembership(className) != null) members.add(t.id);
        }
        return members;
    }

    public String getClassName() {
        return className;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AREA_OF_CLASS;
    }

    @Override
    protected boolean paramsEqual(AreaNavigationNode other) {
        return className.equals(((AreaOfClassNode) other).className);
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList('"' + className + '"');
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return this;
    }
}
