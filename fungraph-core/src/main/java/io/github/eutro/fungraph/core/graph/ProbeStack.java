package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.diag.CycleException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The nodes and constructs currently being built or internalized, innermost last.
 * <p>
 * Past a configurable depth the stack is searched for a repeating tail segment,
 * which is reported as a cycle.
 */
public final class ProbeStack {
    private static final class Frame {
        final String shape;
        final String description;
        @Nullable
        final FunctionNode node;
        @Nullable
        final String construct;

        Frame(String shape, String description, @Nullable FunctionNode node, @Nullable String construct) {
            this.shape = shape;
            this.description = description;
            this.node = node;
            this.construct = construct;
        }
    }

    private final List<Frame> frames = new ArrayList<>();
    private final int maxDepth;

    public ProbeStack(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Push a node being internalized.
     *
     * @param node The node.
     */
    public void push(FunctionNode node) {
        push(new Frame(node.shape(), node.toString(), node, null));
    }

    /**
     * Push a source construct being built.
     *
     * @param construct The construct.
     */
    public void pushConstruct(String construct) {
        push(new Frame(construct, construct, null, construct));
    }

    private void push(Frame frame) {
        frames.add(frame);
        if (frames.size() > maxDepth) {
            int len = findRepeatingTail();
            if (len > 0) {
                List<String> trace = trace(frames.size() - 2 * len);
                String construct = currentConstruct();
                frames.remove(frames.size() - 1);
                throw new CycleException(construct, trace);
            }
        }
    }

    public void pop() {
        frames.remove(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    /**
     * The length of the shortest segment that the stack ends with twice in a row.
     *
     * @return The length, or 0 if there is none.
     */
    public int findRepeatingTail() {
        int size = frames.size();
        search:
        for (int len = 1; 2 * len <= size; len++) {
            for (int i = 0; i < len; i++) {
                if (!frames.get(size - 1 - i).shape.equals(frames.get(size - 1 - len - i).shape)) {
                    continue search;
                }
            }
            return len;
        }
        return 0;
    }

    /**
     * The innermost source construct on the stack.
     *
     * @return The construct, or null.
     */
    @Nullable
    public String currentConstruct() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            String c = frames.get(i).construct;
            if (c != null) return c;
        }
        return null;
    }

    /**
     * The descriptions of the frames from {@code from} to the top.
     *
     * @param from The first frame.
     * @return The trace.
     */
    public List<String> trace(int from) {
        List<String> trace = new ArrayList<>();
        for (int i = Math.max(from, 0); i < frames.size(); i++) {
            trace.add(frames.get(i).description);
        }
        return trace;
    }

    /**
     * The frames from the given node to the top, the path of a cycle through it.
     *
     * @param head The node.
     * @return The trace.
     */
    public List<String> traceFrom(FunctionNode head) {
        List<String> trace = trace(indexOf(head));
        trace.add(head.toString());
        return trace;
    }

    private int indexOf(FunctionNode node) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).node == node) return i;
        }
        return 0;
    }

    /**
     * Find the outermost variant on the cycle through {@code head} that may still be repaired.
     *
     * @param head The node the cycle was found at.
     * @return The variant, or null.
     */
    @Nullable
    public VariantNode findRepairable(FunctionNode head) {
        for (int i = indexOf(head); i < frames.size(); i++) {
            FunctionNode node = frames.get(i).node;
            if (node instanceof VariantNode && ((VariantNode) node).isRepairable()) {
                return (VariantNode) node;
            }
        }
        return null;
    }
}
