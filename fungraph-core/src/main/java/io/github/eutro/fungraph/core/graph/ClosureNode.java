package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.diag.CycleException;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import io.github.eutro.fungraph.core.util.Lazy;

import java.util.*;
import java.util.function.Supplier;

/**
 * {@code defun(params, body)}. The body lives in the closure's own scope, and is built and cached
 * the first time it is requested, so a closure can refer to things defined after it.
 */
public class ClosureNode extends FunctionNode {
    private final int closureId;
    private final List<StorageNode> params;
    private final Lazy<FunctionNode> body;

    public ClosureNode(GraphContext ctx, Scope enclosing, int closureId, List<StorageNode> params, Supplier<FunctionNode> buildBody) {
        super(ctx, enclosing, ValueType.single(ValueType.Base.DEFUN));
        this.closureId = closureId;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = Lazy.lazy(() -> ctx.cache(buildBody.get()));
    }

    public int getClosureId() {
        return closureId;
    }

    public Scope getBodyScope() {
        return Scope.of(scope.template, closureId);
    }

    public List<StorageNode> getParams() {
        return params;
    }

    /**
     * Build and cache the body, if it was not yet.
     *
     * @param ctx The graph context.
     * @return The cached body.
     * @throws CycleException If the body is requested while it is being built.
     */
    public FunctionNode getBody(GraphContext ctx) {
        if (body.isForcing()) {
            throw new CycleException(ctx.constructOf(this),
                    Collections.singletonList("body of closure " + closureId + " requested while it is being built"));
        }
        return body.get();
    }

    public boolean isBodyBuilt() {
        return body.isForced();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLOSURE;
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
        return closureId == ((ClosureNode) other).closureId;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return this;
    }

    @Override
    public boolean isAlwaysTrue() {
        return true;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(closureId));
        args.add(String.valueOf(params.size()));
        if (body.isForced()) args.add(ref.apply(body.get()));
        return args;
    }

    @Override
    public String toString() {
        return super.toString() + "(closure " + closureId + ")";
    }
}
