package io.github.eutro.fungraph.core.passes.meta;

import io.github.eutro.fungraph.core.build.WriteAction;
import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.graph.NodeCache;
import io.github.eutro.fungraph.core.graph.StorageNode;
import io.github.eutro.fungraph.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Computes {@link GraphExts#WRITE_USERS} for each cached node, marks every node a write could pass through
 * to a storage leaf as {@link FunctionNode#isWritable(GraphContext) writable} in the current generation,
 * and lowers the writes of the context to their destinations.
 */
public class MarkWritables implements InPlaceIRPass<GraphContext> {
    private static final Logger logger = LogManager.getLogger();

    /**
     * A singleton instance of this pass.
     */
    public static final MarkWritables INSTANCE = new MarkWritables();

    @Override
    public void runInPlace(GraphContext ctx) {
        List<FunctionNode> nodes = new ArrayList<>();
        for (NodeCache cache : ctx.getCaches()) {
            nodes.addAll(cache.getNodes());
        }
        for (FunctionNode node : nodes) {
            node.removeExt(GraphExts.WRITE_USERS);
        }
        for (FunctionNode node : nodes) {
            for (FunctionNode input : node.getWriteThroughInputs()) {
                input.resolve().getExtOrCompute(GraphExts.WRITE_USERS, ArrayList::new).add(node);
            }
        }

        Deque<FunctionNode> queue = new ArrayDeque<>();
        for (FunctionNode node : nodes) {
            if (node instanceof StorageNode && node.markQueued(ctx)) {
                queue.add(node);
            }
        }
        int writable = 0;
        while (!queue.isEmpty()) {
            FunctionNode node = queue.removeFirst();
            node.markWritable(ctx);
            writable++;
            List<FunctionNode> users = node.getNullable(GraphExts.WRITE_USERS);
            if (users == null) continue;
            for (FunctionNode user : users) {
                if (user.markQueued(ctx)) {
                    queue.addLast(user);
                }
            }
        }

        for (WriteAction write : ctx.getWrites()) {
            write.lower(ctx);
        }
        logger.debug("{} of {} nodes writable in generation {}", writable, nodes.size(), ctx.getGeneration());
    }
}
