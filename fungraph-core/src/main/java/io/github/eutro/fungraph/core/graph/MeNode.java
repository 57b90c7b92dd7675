package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;

import java.util.*;

/**
 * {@code [me]}: the area an expression is evaluated in. Lives in its template's scope.
 */
public class MeNode extends AreaNavigationNode {
    public MeNode(GraphContext ctx, int template) {
        super(ctx, Scope.template(template), null, new TreeSet<>(Collections.singleton(template)),
                areasOf(Collections.singleton(template)).withSize(1, 1));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ME;
    }

    @Override
    public boolean isAlwaysTrue() {
        return true;
    }

    @Override
    protected boolean paramsEqual(AreaNavigationNode other) {
        return true;
    }

    @Override
    protected List<String> exportParams() {
        return Collections.emptyList();
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return this;
    }
}
