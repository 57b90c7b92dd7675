package io.github.eutro.fungraph.core.graph.display;

import io.github.eutro.fungraph.core.graph.ClosureNode;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.graph.GraphContext;

import java.util.*;

/**
 * Renders a node and its inputs as an indented tree, for diagnostics and debugging.
 * <p>
 * Each line shows the node, its cache id, scope, priority and schedule step. A node that was
 * already printed is shown again as a back reference without its inputs.
 */
public final class GraphPrinter {
    private final GraphContext ctx;
    private final int maxDepth;

    public GraphPrinter(GraphContext ctx, int maxDepth) {
        this.ctx = ctx;
        this.maxDepth = maxDepth;
    }

    public GraphPrinter(GraphContext ctx) {
        this(ctx, Integer.MAX_VALUE);
    }

    /**
     * Render a node.
     *
     * @param root The node.
     * @return The rendering, one line per node.
     */
    public String print(FunctionNode root) {
        StringBuilder sb = new StringBuilder();
        print(sb, root.resolve(), 0, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    private void print(StringBuilder sb, FunctionNode node, int depth, Set<FunctionNode> seen) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        sb.append(node.getKind().mnemonic)
                .append(" #").append(node.getSeqNr())
                .append(" id=").append(node.getId())
                .append(' ').append(node.getScope())
                .append(" p").append(node.getPriority())
                .append(" s").append(node.getScheduleStep());
        if (node.hasSchedulingError()) sb.append(" !sched");
        if (node.isWritable(ctx)) sb.append(" writable");
        if (!seen.add(node)) {
            sb.append(" ^\n");
            return;
        }
        sb.append('\n');
        if (depth >= maxDepth) return;
        for (FunctionNode input : node.getInputs()) {
            print(sb, input.resolve(), depth + 1, seen);
        }
        if (node instanceof ClosureNode && ((ClosureNode) node).isBodyBuilt()) {
            print(sb, ((ClosureNode) node).getBody(ctx), depth + 1, seen);
        }
    }
}
