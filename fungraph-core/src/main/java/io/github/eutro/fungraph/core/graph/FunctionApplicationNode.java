package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * Applies a {@link BuiltInFunction} to arguments.
 * <p>
 * Subclasses add parameters that are part of the application but not inputs; they take part in equality
 * and in the export form through {@link #paramsEqual(FunctionApplicationNode)} and {@link #exportParams()}.
 */
public class FunctionApplicationNode extends FunctionNode {
    protected final BuiltInFunction function;
    protected final List<FunctionNode> args;

    public FunctionApplicationNode(GraphContext ctx, BuiltInFunction function, List<FunctionNode> args, int priority) {
        super(ctx, scopeOf(ctx, Scope.GLOBAL, args), resultType(function, args), priority);
        function.checkArity(args.size());
        this.function = function;
        this.args = new ArrayList<>(args);
    }

    public FunctionApplicationNode(GraphContext ctx, BuiltInFunction function, List<FunctionNode> args) {
        this(ctx, function, args, PRIORITY_DEFAULT);
    }

    private static ValueType resultType(BuiltInFunction function, List<FunctionNode> args) {
        F<List<ValueType>, ValueType> rt = function.getNullable(GraphExts.RESULT_TYPE);
        if (rt == null) return ValueType.UNKNOWN;
        List<ValueType> types = new ArrayList<>(args.size());
        for (FunctionNode arg : args) types.add(arg.resolve().getValueType());
        return rt.apply(types);
    }

    public BuiltInFunction getFunction() {
        return function;
    }

    public List<FunctionNode> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public boolean isPure() {
        return Boolean.TRUE.equals(function.getNullable(GraphExts.IS_PURE));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_APPLICATION;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return Collections.unmodifiableList(args);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        args.replaceAll(f::apply);
    }

    @Override
    protected final boolean contentEquals(FunctionNode other) {
        FunctionApplicationNode o = (FunctionApplicationNode) other;
        if (function != o.function || priority != o.priority || args.size() != o.args.size()) return false;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) != o.args.get(i)) return false;
        }
        return paramsEqual(o);
    }

    protected boolean paramsEqual(FunctionApplicationNode other) {
        return true;
    }

    protected List<String> exportParams() {
        return Collections.emptyList();
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new FunctionApplicationNode(ctx, function, inputs, priority);
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        if (!isPure()) return this;
        F<List<Object>, Object> folder = function.getNullable(GraphExts.CONSTANT_FOLDER);
        if (folder == null) return this;
        List<Object> values = new ArrayList<>(args.size());
        for (FunctionNode arg : args) {
            FunctionNode a = arg.resolve();
            if (!(a instanceof ConstNode) || !((ConstNode) a).wontChangeValue()) return this;
            values.add(((ConstNode) a).getValue());
        }
        Object folded = folder.apply(values);
        return folded == null ? this : new ConstNode(ctx, folded);
    }

    @Override
    public boolean isAlwaysTrue() {
        F<List<FunctionNode>, Boolean> rule = function.getNullable(GraphExts.ALWAYS_TRUE);
        return rule != null && rule.apply(args);
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        Integer arg = function.getNullable(GraphExts.WRITE_THROUGH_ARG);
        return arg == null ? Collections.emptyList() : Collections.singletonList(args.get(arg));
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        Integer arg = function.getNullable(GraphExts.WRITE_THROUGH_ARG);
        if (arg == null) return null;
        return args.get(arg).extractWritableDestinations(ctx, path, visited);
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> out = new ArrayList<>();
        out.add(function.mnemonic);
        out.addAll(exportParams());
        for (FunctionNode arg : args) out.add(ref.apply(arg));
        return out;
    }

    @Override
    public String shape() {
        return super.shape() + function.mnemonic + exportParams();
    }

    @Override
    public String toString() {
        return super.toString() + "(" + function.mnemonic + ")";
    }
}
