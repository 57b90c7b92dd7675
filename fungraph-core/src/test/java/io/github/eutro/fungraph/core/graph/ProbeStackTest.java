package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.diag.CycleException;
import io.github.eutro.fungraph.core.diag.Diagnostic;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ProbeStackTest {
    @Test
    void repeatingTail() {
        ProbeStack probes = new ProbeStack(100);
        assertEquals(0, probes.findRepeatingTail());
        probes.pushConstruct("x");
        probes.pushConstruct("y");
        assertEquals(0, probes.findRepeatingTail());
        probes.pushConstruct("z");
        probes.pushConstruct("y");
        probes.pushConstruct("z");
        assertEquals(2, probes.findRepeatingTail());
        probes.pushConstruct("z");
        assertEquals(1, probes.findRepeatingTail());
    }

    @Test
    void overflowWithRepetitionIsACycle() {
        ProbeStack probes = new ProbeStack(4);
        probes.pushConstruct("a");
        probes.pushConstruct("b");
        probes.pushConstruct("a");
        probes.pushConstruct("b");
        CycleException e = assertThrows(CycleException.class, () -> probes.pushConstruct("a"));
        assertEquals(Arrays.asList("b", "a", "b", "a"), e.getTrace());
        assertEquals(Diagnostic.Kind.STRUCTURAL_CYCLE, e.getDiagnostic().kind);
        assertEquals("a", e.getDiagnostic().construct);
        assertEquals(4, probes.depth());
    }

    @Test
    void deepStacksWithoutRepetitionAreFine() {
        ProbeStack probes = new ProbeStack(2);
        probes.pushConstruct("a");
        probes.pushConstruct("b");
        probes.pushConstruct("c");
        assertEquals(3, probes.depth());
        probes.pop();
        assertEquals("b", probes.currentConstruct());
    }

    @Test
    void constructsAndNodes() {
        GraphContext ctx = new GraphContext(GraphOptions.DEFAULT, new TemplateTree());
        ConstNode node = new ConstNode(ctx, 1);
        ProbeStack probes = new ProbeStack(100);
        assertNull(probes.currentConstruct());
        probes.pushConstruct("outer");
        probes.push(node);
        assertEquals("outer", probes.currentConstruct());
        assertEquals(Arrays.asList(node.toString(), node.toString()), probes.traceFrom(node));
        assertEquals(2, probes.trace(0).size());
        assertNull(probes.findRepairable(node));
    }
}
