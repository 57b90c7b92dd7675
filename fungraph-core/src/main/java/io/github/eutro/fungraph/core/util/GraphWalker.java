package io.github.eutro.fungraph.core.util;

import io.github.eutro.fungraph.core.graph.ClosureNode;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.graph.GraphContext;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The roots of the walk.
     */
    final List<T> roots;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from root nodes and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param roots       The roots of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(Collection<? extends T> roots, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.roots = new ArrayList<>(roots);
        this.getChildren = getChildren;
    }

    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this(Collections.singletonList(root), getChildren);
    }

    /**
     * Create a graph walker over function nodes, from users to their inputs.
     * <p>
     * Forward references are followed to their targets, and the bodies of closures that
     * have been built count as children of the closure.
     *
     * @param ctx   The graph context.
     * @param roots The nodes to start from.
     * @return The graph walker.
     */
    public static GraphWalker<FunctionNode> nodeWalker(GraphContext ctx, Collection<? extends FunctionNode> roots) {
        List<FunctionNode> resolved = new ArrayList<>(roots.size());
        for (FunctionNode root : roots) resolved.add(root.resolve());
        return new GraphWalker<FunctionNode>(resolved, node -> {
            List<FunctionNode> children = new ArrayList<>();
            for (FunctionNode input : node.getInputs()) children.add(input.resolve());
            if (node instanceof ClosureNode && ((ClosureNode) node).isBodyBuilt()) {
                children.add(((ClosureNode) node).getBody(ctx));
            }
            return children;
        });
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph: every node comes after all of its children.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private Set<T> newSeenSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = newSeenSet();

        {
            for (int i = roots.size() - 1; i >= 0; i--) {
                if (seen.add(roots.get(i))) stack.add(roots.get(i));
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        @SuppressWarnings("unchecked")
        private final T sentinel = (T) new Object();
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = newSeenSet();

        {
            for (int i = roots.size() - 1; i >= 0; i--) {
                if (seen.add(roots.get(i))) stack.addLast(roots.get(i));
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                T last = stack.getLast();
                if (last == sentinel) {
                    stack.removeLast();
                    return stack.removeLast();
                } else {
                    stack.addLast(sentinel);
                    for (T next : getChildren.apply(last)) {
                        if (seen.add(next)) {
                            stack.addLast(next);
                        }
                    }
                }
            }
        }
    }
}
