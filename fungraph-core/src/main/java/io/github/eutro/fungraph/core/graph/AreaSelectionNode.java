package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * {@code [{attr: selection}, areas]}: the areas whose exported attribute matches the selection.
 */
public class AreaSelectionNode extends AreaNavigationNode {
    private final int exportId;
    private FunctionNode selection;

    public AreaSelectionNode(GraphContext ctx, int exportId, FunctionNode selection, FunctionNode areas) {
        super(ctx, selection.resolve().getScope(), areas, areas.resolve().getValueType().getAreas(),
                areasOf(areas.resolve().getValueType().getAreas()));
        this.exportId = exportId;
        this.selection = selection;
    }

    public int getExportId() {
        return exportId;
    }

    public FunctionNode getSelection() {
        return selection;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AREA_SELECTION;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return Arrays.asList(selection, data);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        selection = f.apply(selection);
        super.replaceInputs(f);
    }

    @Override
    protected boolean paramsEqual(AreaNavigationNode other) {
        AreaSelectionNode o = (AreaSelectionNode) other;
        return exportId == o.exportId && selection == o.selection;
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList(String.valueOf(exportId));
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = super.exportArguments(ref);
        args.add(1, ref.apply(selection));
        return args;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new AreaSelectionNode(ctx, exportId, inputs.get(0), inputs.get(1));
    }
}
