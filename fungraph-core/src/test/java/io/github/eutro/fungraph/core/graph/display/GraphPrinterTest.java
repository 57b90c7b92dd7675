package io.github.eutro.fungraph.core.graph.display;

import io.github.eutro.fungraph.core.build.GraphBuilder;
import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.graph.BuiltInFunctions;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.graph.StorageNode;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GraphPrinterTest {
    @Test
    void sharedInputsArePrintedOnce() {
        TemplateTree templates = new TemplateTree();
        GraphBuilder b = new GraphBuilder(new GraphContext(GraphOptions.DEFAULT, templates));
        StorageNode x = b.areaState(templates.getRoot(), "x", null);
        FunctionNode twice = b.apply(BuiltInFunctions.PLUS, x, x);

        String[] lines = new GraphPrinter(b.getContext()).print(twice).split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[0].startsWith("apply #"));
        assertTrue(lines[0].contains(" id=1 @1 p0 s1"));
        assertTrue(lines[1].startsWith("  storage #"));
        assertFalse(lines[1].endsWith("^"));
        assertTrue(lines[2].endsWith(" ^"));

        assertEquals(1, new GraphPrinter(b.getContext(), 0).print(twice).split("\n").length);
    }
}
