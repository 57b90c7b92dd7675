package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;

import java.util.*;

/**
 * {@code [{attr: _}, areas]}: the value an exported attribute has in each of the areas.
 */
public class AreaProjectionNode extends AreaNavigationNode {
    private final int exportId;
    private final String attribute;

    public AreaProjectionNode(GraphContext ctx, int exportId, String attribute, FunctionNode areas) {
        super(ctx, Scope.GLOBAL, areas, areas.resolve().getValueType().getAreas(), ValueType.UNKNOWN);
        this.exportId = exportId;
        this.attribute = attribute;
        ValueType vt = ValueType.UNDEFINED;
        for (int t : templates) {
            FunctionNode export = ctx.getTemplates().getTemplate(t).getExport(exportId);
            if (export == null) continue;
            vt = vt.merge(export.resolve().getValueType());
        }
        this.valueType = vt.addSize(0, ValueType.UNBOUNDED);
    }

    public int getExportId() {
        return exportId;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AREA_PROJECTION;
    }

    @Override
    protected boolean paramsEqual(AreaNavigationNode other) {
        return exportId == ((AreaProjectionNode) other).exportId;
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList(String.valueOf(exportId));
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new AreaProjectionNode(ctx, exportId, attribute, inputs.get(0));
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        List<WritableDestination> dests = new ArrayList<>();
        for (int t : templates) {
            AreaTemplate template = ctx.getTemplates().getTemplate(t);
            FunctionNode export = template.getExport(exportId);
            if (export == null) return null;
            List<WritableDestination> ds = export.extractWritableDestinations(ctx, path, visited);
            if (ds == null) return null;
            dests.addAll(ds);
        }
        return dests;
    }
}
