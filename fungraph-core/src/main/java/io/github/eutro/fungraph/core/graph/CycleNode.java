package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.Collections;
import java.util.List;

/**
 * Stands for a context attribute in a qualifier on that same attribute. The builder
 * replaces it before the variant is cached; internalizing it is a cycle.
 */
public final class CycleNode extends FunctionNode {
    private final String attribute;

    public CycleNode(GraphContext ctx, Scope scope, String attribute) {
        super(ctx, scope, ValueType.UNKNOWN);
        this.attribute = attribute;
        this.id = CYCLE_SENTINEL;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CYCLE;
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
        return false;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return this;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        throw new IllegalStateException("cycle on " + attribute + " cannot be exported");
    }

    @Override
    public String toString() {
        return super.toString() + "(" + attribute + ")";
    }
}
