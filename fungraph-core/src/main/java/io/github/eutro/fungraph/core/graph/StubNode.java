package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A forward reference to a context attribute that is still being built.
 * <p>
 * Once the attribute's node exists the stub is {@link #resolveTo(FunctionNode) resolved}, and
 * {@link #resolve()} returns that node from then on. Stubs are never cached.
 */
public final class StubNode extends FunctionNode {
    private final String description;

    public StubNode(GraphContext ctx, Scope scope, String description) {
        super(ctx, scope, ValueType.UNKNOWN);
        this.description = description;
        this.id = UNRESOLVED_REFERENCE;
    }

    /**
     * Point this reference at the node it stands for. A stub may be re-pointed while its target is uncached.
     *
     * @param target The target.
     */
    public void resolveTo(FunctionNode target) {
        setReplacement(target);
        id = RESOLVED_REFERENCE;
    }

    public boolean isResolved() {
        return id == RESOLVED_REFERENCE;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STUB;
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
    public FunctionNode pickQualifiedExpression(GraphContext ctx, KnownQualifiers known) {
        if (isResolved()) return resolve().pickQualifiedExpression(ctx, known);
        Optional<Object> knownValue = known.knownValue(this);
        if (knownValue.isPresent() && !(knownValue.get() instanceof Boolean)) {
            return new ConstNode(ctx, knownValue.get());
        }
        return this;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        throw new IllegalStateException("forward reference " + description + " cannot be exported");
    }

    @Override
    public String shape() {
        return super.shape() + description;
    }

    @Override
    public String toString() {
        return super.toString() + "(" + description + ")";
    }
}
