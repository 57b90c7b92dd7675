package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import io.github.eutro.fungraph.core.types.ValueType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeCacheTest {
    final GraphContext ctx = new GraphContext(GraphOptions.DEFAULT, new TemplateTree());

    StorageNode storage(int i) {
        return new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                Collections.singletonList("s" + i), null, ValueType.UNDEFINED);
    }

    @Test
    void findOnlyProbesAboveTheWatermark() {
        NodeCache cache = new NodeCache(Scope.template(1));
        for (int i = 0; i < 5; i++) cache.add(storage(i));
        StorageNode second = (StorageNode) cache.get(1);
        assertSame(second, cache.find(storage(1), -1));
        assertSame(second, cache.find(storage(1), 0));
        assertNull(cache.find(storage(1), 1));
        assertNull(cache.find(storage(7), -1));
        assertNull(cache.find(new ConstNode(ctx, 1), -1));
    }

    @Test
    void compactionRenumbersDensely() {
        NodeCache cache = new NodeCache(Scope.template(1));
        List<FunctionNode> nodes = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            StorageNode s = storage(i);
            cache.add(s);
            nodes.add(s);
        }
        int dropped = cache.compact(n -> n.getId() % 2 == 0);
        assertEquals(3, dropped);
        assertEquals(3, cache.size());
        for (int i = 0; i < 6; i++) {
            FunctionNode n = nodes.get(i);
            if (i % 2 == 0) {
                assertEquals(i / 2, n.getId());
                assertSame(n, cache.get(i / 2));
            } else {
                assertEquals(FunctionNode.COMPACTED, n.getId());
                assertFalse(n.isCached());
            }
        }
        assertSame(nodes.get(4), cache.find(storage(4), -1));
        assertNull(cache.find(storage(3), -1));
    }
}
