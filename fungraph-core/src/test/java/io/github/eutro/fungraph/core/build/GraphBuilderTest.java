package io.github.eutro.fungraph.core.build;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.diag.CycleException;
import io.github.eutro.fungraph.core.diag.Diagnostic;
import io.github.eutro.fungraph.core.graph.*;
import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import io.github.eutro.fungraph.core.types.ValueType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GraphBuilderTest {
    final TemplateTree templates = new TemplateTree();
    final AreaTemplate root = templates.getRoot();

    GraphBuilder builder(GraphOptions options) {
        return new GraphBuilder(new GraphContext(options, templates));
    }

    static double valueOf(FunctionNode node) {
        FunctionNode n = node.resolve();
        assertTrue(n instanceof ConstNode, () -> n + " is not a constant");
        return (Double) ((ConstNode) n).getValue();
    }

    @Test
    void sharedSubexpressions() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        StorageNode x = b.areaState(root, "x", null);
        FunctionNode one = b.apply(BuiltInFunctions.PLUS, x, b.constant(1));
        FunctionNode two = b.apply(BuiltInFunctions.PLUS, b.areaState(root, "x", null), b.constant(1.0));
        assertSame(one, two);
        assertTrue(one.isCached());
        assertEquals(3.0, ((ConstNode) b.apply(BuiltInFunctions.PLUS, b.constant(1), b.constant(2))).getValue());
    }

    @Test
    void halfOpenRangesKeepBoundOrder() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        StorageNode x = b.areaState(root, "x", null);
        StorageNode y = b.areaState(root, "y", null);
        assertNotSame(b.range(x, y, true, false), b.range(y, x, true, false));
        assertSame(b.range(x, y, true, true), b.range(y, x, true, true));
        assertSame(b.range(x, y, false, false), b.range(y, x, false, false));
        assertSame(b.range(x, y, true, false), b.range(x, y, true, false));
    }

    @Test
    void projectionBeforeExportWidensType() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        FunctionNode before = b.project("label", b.me(root));
        assertFalse(before.getValueType().has(ValueType.Base.STRING));
        b.export(root, "label", b.constant("hi"));
        FunctionNode after = b.project("label", b.me(root));
        assertSame(before, after);
        assertTrue(before.getValueType().has(ValueType.Base.STRING));
    }

    @Test
    void undefinedAttributesAreEmpty() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        FunctionNode missing = b.contextAttribute(root, "missing", KnownQualifiers.EMPTY);
        assertTrue(((ConstNode) missing).isUndefined());
    }

    @Test
    void attributesAreBuiltOnce() {
        int[] builds = {0};
        root.defineContext("counted", (b, t, k) -> {
            builds[0]++;
            return b.constant(7);
        });
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        b.buildAll();
        b.buildAll();
        assertEquals(7.0, valueOf(b.contextAttribute(root, "counted", KnownQualifiers.EMPTY)));
        assertEquals(1, builds[0]);
    }

    @Test
    void variantsSpecializeUnderKnownQualifiers() {
        root.defineContext("mode", (b, t, k) -> b.areaState(t, "mode", null));
        root.defineContext("width", (b, t, k) -> b.variant(t, Arrays.asList(
                VariantTerm.when("mode", "wide", ContextDefinition.constant(200)),
                VariantTerm.when("mode", "narrow", ContextDefinition.constant(50)),
                VariantTerm.always(ContextDefinition.constant(100))), k));
        GraphBuilder b = builder(GraphOptions.DEFAULT.withOptimize(true));
        b.buildAll();
        FunctionNode width = b.getContextAttribute(root, "width");
        assertTrue(width instanceof VariantNode);
        assertEquals(3, ((VariantNode) width).getAlternatives().size());

        FunctionNode mode = b.getContextAttribute(root, "mode");
        KnownQualifiers wide = KnownQualifiers.EMPTY.assume(Conjunction.of(new SingleQualifier(mode, "mode", "wide", root.id)));
        KnownQualifiers notNarrow = KnownQualifiers.EMPTY.assume(Conjunction.of(new SingleQualifier(mode, "mode", "other", root.id)));
        assertEquals(200.0, valueOf(b.contextAttribute(root, "width", wide)));
        assertEquals(100.0, valueOf(b.contextAttribute(root, "width", notNarrow)));
    }

    @Test
    void selfReferencesAreRepaired() {
        root.defineContext("c", (b, t, k) -> b.areaState(t, "c", null));
        root.defineContext("a", (b, t, k) -> b.definingVariant(t, Arrays.asList(
                VariantTerm.when("c", 1, (b2, t2, k2) -> b2.contextAttribute(t2, "b", k2)),
                VariantTerm.always(ContextDefinition.constant(3))), k));
        root.defineContext("b", (b, t, k) -> b.definingVariant(t, Arrays.asList(
                VariantTerm.when("c", 1, ContextDefinition.constant(5)),
                VariantTerm.always((b2, t2, k2) -> b2.contextAttribute(t2, "a", k2))), k));
        GraphBuilder b = builder(GraphOptions.DEFAULT.withOptimize(false));
        b.buildAll();
        b.complete();

        VariantNode a = (VariantNode) b.getContextAttribute(root, "a");
        assertTrue(a.isCached());
        assertEquals(5.0, valueOf(a.getAlternatives().get(0)));
        assertEquals(3.0, valueOf(a.getAlternatives().get(1)));
        assertTrue(a.getGuards().get(1).isTrue());

        VariantNode bNode = (VariantNode) b.getContextAttribute(root, "b");
        assertTrue(bNode.isCached());
        assertSame(a, bNode.getAlternatives().get(1).resolve());
        assertTrue(b.getContext().getDiagnostics().getReported().isEmpty());
    }

    @Test
    void genuineCyclesAreReported() {
        root.defineContext("a", (b, t, k) -> b.definingVariant(t, Arrays.asList(
                VariantTerm.when("a", 1, (b2, t2, k2) -> b2.areaState(t2, "s", null)),
                VariantTerm.always(ContextDefinition.constant(2))), k));
        GraphBuilder b = builder(GraphOptions.DEFAULT.withOptimize(false));
        CycleException e = assertThrows(CycleException.class, b::buildAll);
        assertEquals(Diagnostic.Kind.STRUCTURAL_CYCLE, e.getDiagnostic().kind);
        assertEquals(1, b.getContext().getDiagnostics().count(Diagnostic.Kind.CYCLIC_QUALIFIER));
        assertEquals(0, b.getContext().getProbes().depth());
    }

    @Test
    void cyclesWithoutVariantsAreReported() {
        root.defineContext("a", (b, t, k) -> b.apply(BuiltInFunctions.PLUS,
                b.contextAttribute(t, "b", k), b.constant(1)));
        root.defineContext("b", (b, t, k) -> b.apply(BuiltInFunctions.PLUS,
                b.contextAttribute(t, "a", k), b.constant(1)));
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        b.buildAll();
        assertFalse(b.getContextAttribute(root, "a").isCached());
        assertThrows(CycleException.class, b::complete);
    }

    @Test
    void redundantSelfQualifiers() {
        root.defineContext("a", (b, t, k) -> b.definingVariant(t, Arrays.asList(
                VariantTerm.when("a", 1, ContextDefinition.constant(1)),
                VariantTerm.always(ContextDefinition.constant(2))), k));
        GraphBuilder b = builder(GraphOptions.DEFAULT.withOptimize(false));
        b.buildAll();
        b.complete();
        assertEquals(1.0, valueOf(b.getContextAttribute(root, "a")));
        assertEquals(1, b.getContext().getDiagnostics().count(Diagnostic.Kind.CYCLIC_QUALIFIER));
    }

    @Test
    void contradictorySelfQualifiers() {
        root.defineContext("a", (b, t, k) -> b.definingVariant(t, Arrays.asList(
                VariantTerm.when("a", 1, ContextDefinition.constant(5)),
                VariantTerm.always(ContextDefinition.constant(2))), k));
        GraphBuilder b = builder(GraphOptions.DEFAULT.withOptimize(false));
        b.buildAll();
        b.complete();
        assertEquals(2.0, valueOf(b.getContextAttribute(root, "a")));
        assertEquals(1, b.getContext().getDiagnostics().count(Diagnostic.Kind.CYCLIC_QUALIFIER));
    }

    @Test
    void writesThroughCondSplitByGuard() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        StorageNode x = b.areaState(root, "x", null);
        StorageNode left = b.areaState(root, "left", null);
        StorageNode right = b.areaState(root, "right", null);
        FunctionNode target = b.cond(x, Arrays.asList(b.constant(true), b.constant(false)), Arrays.asList(left, right));
        WriteAction write = b.write("toggle", b.messageQueue(), target, b.constant(5));
        b.complete();

        List<WritableDestination> dests = write.lower(b.getContext());
        assertFalse(write.isNoOp());
        assertEquals(2, dests.size());
        assertSame(left, dests.get(0).storage);
        assertEquals(Conjunction.of(SingleQualifier.onNode(x, true)), dests.get(0).guard);
        assertSame(right, dests.get(1).storage);
        assertEquals(Conjunction.of(SingleQualifier.onNode(x, false)), dests.get(1).guard);
        assertTrue(left.getValueType().has(ValueType.Base.NUMBER));
        assertTrue(target.isOnWriteOutputPath(b.getContext()));
    }

    @Test
    void writesThroughAttributeValuesAndExports() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        StorageNode count = b.areaState(root, "count", null);
        b.export(root, "record", b.av(Collections.singletonMap("count", count)));
        FunctionNode target = b.query(Collections.singletonList("count"), b.project("record", b.me(root)));
        WriteAction write = b.write("increment", b.messageQueue(), target, b.constant(1));
        b.complete();

        List<WritableDestination> dests = write.lower(b.getContext());
        assertEquals(1, dests.size());
        assertSame(count, dests.get(0).storage);
        assertTrue(dests.get(0).path.isEmpty());
        assertTrue(dests.get(0).guard.isTrue());
    }

    @Test
    void unsupportedWritesAreNoOps() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        StorageNode x = b.areaState(root, "x", null);
        WriteAction toConstant = b.write("toConstant", b.messageQueue(), b.constant(1), b.constant(2));
        WriteAction toSum = b.write("toSum", b.messageQueue(), b.apply(BuiltInFunctions.PLUS, x, b.constant(1)), b.constant(2));
        WriteAction toSumAgain = b.write("toSum", b.messageQueue(), b.apply(BuiltInFunctions.MUL, x, b.constant(2)), b.constant(2));
        b.complete();
        GraphContext ctx = b.getContext();
        assertTrue(toConstant.lower(ctx).isEmpty());
        assertTrue(toSum.lower(ctx).isEmpty());
        assertTrue(toSumAgain.lower(ctx).isEmpty());
        assertTrue(toConstant.isNoOp() && toSum.isNoOp() && toSumAgain.isNoOp());
        assertEquals(2, ctx.getDiagnostics().count(Diagnostic.Kind.UNSUPPORTED_WRITE_TARGET));
        assertFalse(ctx.getDiagnostics().hasErrors());
    }

    @Test
    void closureBodiesAreBuiltOnCompletion() {
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        ClosureNode inc = b.closure(Scope.template(root.id), 1,
                params -> b.apply(BuiltInFunctions.PLUS, params.get(0), b.constant(1)));
        assertFalse(inc.isBodyBuilt());
        b.complete();
        assertTrue(inc.isBodyBuilt());
        FunctionNode body = inc.getBody(b.getContext());
        assertTrue(body.isCached());
        assertEquals(inc.getBodyScope(), body.getScope());
        assertEquals(1, templates.getClosureCount());
        assertTrue(b.getContext().getRoots().contains(inc));
    }

    @Test
    void exportsAndMembershipsAreCached() {
        AreaTemplate item = templates.addChild(root, "item");
        item.defineContext("selected", (b, t, k) -> b.areaState(t, "selected", b.constant(false)));
        GraphBuilder b = builder(GraphOptions.DEFAULT);
        b.buildAll();
        b.export(item, "label", b.constant("hi"));
        b.classMembership(item, "Selected", b.getContextAttribute(item, "selected"));
        b.complete();
        assertTrue(item.getExport(templates.exportId("label")).isCached());
        assertTrue(item.getClassMembership("Selected").isCached());
        assertEquals(Scope.template(item.id), item.getClassMembership("Selected").getScope());
    }
}
