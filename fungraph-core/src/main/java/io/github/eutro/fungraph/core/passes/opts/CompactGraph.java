package io.github.eutro.fungraph.core.passes.opts;

import io.github.eutro.fungraph.core.build.WriteAction;
import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.graph.NodeCache;
import io.github.eutro.fungraph.core.passes.InPlaceIRPass;
import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.util.GraphWalker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Drops every cached node that is not reachable from a root of the graph, and renumbers the rest.
 * <p>
 * The roots are the context roots, the exports and class memberships of every template, and the nodes of every write.
 */
public class CompactGraph implements InPlaceIRPass<GraphContext> {
    private static final Logger logger = LogManager.getLogger();

    /**
     * A singleton instance of this pass.
     */
    public static final CompactGraph INSTANCE = new CompactGraph();

    @Override
    public void runInPlace(GraphContext ctx) {
        List<FunctionNode> roots = new ArrayList<>(ctx.getRoots());
        for (AreaTemplate template : ctx.getTemplates().getTemplates()) {
            roots.addAll(template.getExports().values());
            roots.addAll(template.getClassMemberships().values());
        }
        for (WriteAction write : ctx.getWrites()) {
            roots.addAll(write.getNodes());
        }

        Set<FunctionNode> live = Collections.newSetFromMap(new IdentityHashMap<>());
        for (FunctionNode node : GraphWalker.nodeWalker(ctx, roots).preOrder()) {
            live.add(node);
        }

        int dropped = 0;
        for (NodeCache cache : ctx.getCaches()) {
            dropped += cache.compact(live::contains);
            for (FunctionNode node : cache.getNodes()) {
                // memoized specializations may refer to dropped nodes
                node.removeExt(GraphExts.SPECIALIZATIONS);
            }
        }
        logger.debug("compacted away {} nodes, {} remain", dropped, ctx.size());
    }
}
