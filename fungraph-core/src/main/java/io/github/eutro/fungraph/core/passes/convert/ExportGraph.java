package io.github.eutro.fungraph.core.passes.convert;

import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.graph.NodeCache;
import io.github.eutro.fungraph.core.passes.IRPass;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;

/**
 * Converts the cached graph to its export form.
 * <p>
 * Each node becomes a line {@code template/closure pPRIORITY sSTEP ID:KIND(ARGS)}, in id order per scope,
 * global scope first. An input is written {@code [levelDelta,id]}, where {@code levelDelta} is how many
 * templates up the input lives ({@code -1} for the global scope); an input in an enclosing closure
 * is written {@code [levelDelta,id,closure]}.
 */
public class ExportGraph implements IRPass<GraphContext, GraphExport> {
    /**
     * A singleton instance of this pass.
     */
    public static final ExportGraph INSTANCE = new ExportGraph();

    @Override
    public GraphExport run(GraphContext ctx) {
        GraphExport export = new GraphExport();
        TemplateTree templates = ctx.getTemplates();
        for (NodeCache cache : ctx.getCaches()) {
            Scope scope = cache.getScope();
            for (FunctionNode node : cache.getNodes()) {
                String args = String.join(",", node.exportArguments(input -> reference(templates, node, input.resolve())));
                export.add(scope, scope.template + "/" + scope.closure
                        + " p" + node.getPriority()
                        + " s" + node.getScheduleStep()
                        + " " + node.getId() + ":" + node.getKind().mnemonic + "(" + args + ")");
            }
        }
        return export;
    }

    /**
     * Render a reference from {@code user} to {@code input}.
     *
     * @param templates The template tree.
     * @param user      The node referring to the input.
     * @param input     The cached input.
     * @return The reference.
     */
    public static String reference(TemplateTree templates, FunctionNode user, FunctionNode input) {
        if (!input.isCached()) {
            throw new IllegalStateException(user + " refers to uncached " + input);
        }
        Scope from = user.getScope();
        Scope to = input.getScope();
        int levelDelta = to.isGlobal()
                ? -1
                : templates.templateDepth(from.template) - templates.templateDepth(to.template);
        String ref = "[" + levelDelta + "," + input.getId();
        if (!to.isGlobal() && to.closure != from.closure) ref += "," + to.closure;
        return ref + "]";
    }
}
