package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Base class of nodes that navigate the area tree. The set of area templates the result
 * refers to takes part in equality and in the export form.
 */
public abstract class AreaNavigationNode extends FunctionNode {
    @Nullable
    protected FunctionNode data;
    protected final SortedSet<Integer> templates;

    protected AreaNavigationNode(GraphContext ctx, Scope scope, @Nullable FunctionNode data,
                                 SortedSet<Integer> templates, ValueType valueType) {
        super(ctx, data == null ? scope : scopeOf(ctx, scope, Collections.singletonList(data)), valueType);
        this.data = data;
        this.templates = Collections.unmodifiableSortedSet(new TreeSet<>(templates));
    }

    /**
     * The value type of an ordered set of areas of the given templates.
     *
     * @param templates The templates.
     * @return The value type.
     */
    protected static ValueType areasOf(Collection<Integer> templates) {
        ValueType vt = ValueType.UNDEFINED;
        for (int t : templates) vt = vt.addArea(t);
        return vt.withSize(0, ValueType.UNBOUNDED);
    }

    @Nullable
    public FunctionNode getData() {
        return data;
    }

    public SortedSet<Integer> getTemplates() {
        return templates;
    }

    protected abstract boolean paramsEqual(AreaNavigationNode other);

    protected abstract List<String> exportParams();

    @Override
    public List<FunctionNode> getInputs() {
        return data == null ? Collections.emptyList() : Collections.singletonList(data);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        if (data != null) data = f.apply(data);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        AreaNavigationNode o = (AreaNavigationNode) other;
        return data == o.data && templates.equals(o.templates) && paramsEqual(o);
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>(exportParams());
        args.add(templates.toString().replace(" ", ""));
        if (data != null) args.add(ref.apply(data));
        return args;
    }

    @Override
    public String shape() {
        return super.shape() + exportParams() + templates;
    }
}
