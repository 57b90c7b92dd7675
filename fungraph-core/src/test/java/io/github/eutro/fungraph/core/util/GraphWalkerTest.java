package io.github.eutro.fungraph.core.util;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphWalkerTest {
    static final Map<String, List<String>> GRAPH = new HashMap<>();

    static {
        GRAPH.put("a", Arrays.asList("b", "c"));
        GRAPH.put("b", Collections.singletonList("d"));
        GRAPH.put("c", Arrays.asList("d", "a"));
        GRAPH.put("d", Collections.emptyList());
        GRAPH.put("e", Collections.singletonList("d"));
    }

    static GraphWalker<String> walker(String... roots) {
        return new GraphWalker<String>(Arrays.asList(roots), GRAPH::get);
    }

    @Test
    void preOrderVisitsLaterChildrenFirst() {
        assertEquals(Arrays.asList("a", "c", "d", "b"), walker("a").preOrder().toList());
    }

    @Test
    void postOrderVisitsChildrenBeforeParents() {
        List<String> order = walker("a").postOrder().toList();
        assertEquals(4, order.size());
        assertEquals("a", order.get(order.size() - 1));
        assertTrue(order.indexOf("d") < order.indexOf("b"));
        assertTrue(order.indexOf("d") < order.indexOf("c"));
    }

    @Test
    void multipleRootsAreVisitedOnce() {
        assertEquals(Arrays.asList("e", "d", "a", "c", "b"), walker("e", "a").preOrder().toList());
        assertEquals(walker("a").preOrder().toList(), walker("a", "a").preOrder().toList());
    }

    @Test
    void exhaustedIteratorsThrow() {
        Iterator<String> pre = new GraphWalker<String>("d", GRAPH::get).preOrder().iterator();
        assertEquals("d", pre.next());
        assertFalse(pre.hasNext());
        assertThrows(NoSuchElementException.class, pre::next);

        Iterator<String> post = new GraphWalker<String>("d", GRAPH::get).postOrder().iterator();
        assertEquals("d", post.next());
        assertThrows(NoSuchElementException.class, post::next);
    }
}
