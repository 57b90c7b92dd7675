package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.scope.Scope;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Predicate;

/**
 * The nodes of one scope, by id, with a per-kind index of ids in ascending order.
 * <p>
 * A node can only equal a node cached after all of its inputs from the same scope, so
 * {@link #find(FunctionNode, int)} only probes the tail of the index above the highest such input id.
 */
public final class NodeCache {
    private final Scope scope;
    private final List<FunctionNode> nodes = new ArrayList<>();
    private final EnumMap<NodeKind, List<FunctionNode>> byKind = new EnumMap<>(NodeKind.class);

    public NodeCache(Scope scope) {
        this.scope = scope;
    }

    public Scope getScope() {
        return scope;
    }

    public List<FunctionNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public FunctionNode get(int id) {
        return nodes.get(id);
    }

    /**
     * Find a cached node equal to {@code node}.
     *
     * @param node      The node, with cached inputs.
     * @param watermark The highest id of an input of {@code node} in this scope, or -1.
     * @return The equal node, or null.
     */
    @Nullable
    public FunctionNode find(FunctionNode node, int watermark) {
        List<FunctionNode> ofKind = byKind.get(node.getKind());
        if (ofKind == null) return null;
        for (int i = firstAbove(ofKind, watermark); i < ofKind.size(); i++) {
            FunctionNode candidate = ofKind.get(i);
            if (node.isEqual(candidate)) return candidate;
        }
        return null;
    }

    private static int firstAbove(List<FunctionNode> ofKind, int watermark) {
        int lo = 0;
        int hi = ofKind.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (ofKind.get(mid).id <= watermark) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    void add(FunctionNode node) {
        node.id = nodes.size();
        nodes.add(node);
        byKind.computeIfAbsent(node.getKind(), $ -> new ArrayList<>()).add(node);
    }

    /**
     * Drop every node that is not kept, and renumber the rest densely in their existing order.
     *
     * @param keep Which nodes to keep.
     * @return The number of nodes dropped.
     */
    public int compact(Predicate<FunctionNode> keep) {
        List<FunctionNode> old = new ArrayList<>(nodes);
        nodes.clear();
        byKind.clear();
        int dropped = 0;
        for (FunctionNode node : old) {
            if (keep.test(node)) {
                add(node);
            } else {
                node.id = FunctionNode.COMPACTED;
                dropped++;
            }
        }
        return dropped;
    }

    @Override
    public String toString() {
        return "NodeCache{" + scope + ", " + nodes.size() + " nodes}";
    }
}
