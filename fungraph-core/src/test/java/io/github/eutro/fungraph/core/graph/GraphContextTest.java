package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.diag.*;
import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import io.github.eutro.fungraph.core.types.ValueType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class GraphContextTest {
    final TemplateTree templates = new TemplateTree();
    GraphContext ctx = new GraphContext(GraphOptions.DEFAULT, templates);

    StorageNode storage(AreaTemplate template, String name) {
        return new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(template.id),
                Collections.singletonList(name), null, ValueType.UNDEFINED);
    }

    StorageNode storage(String name) {
        return storage(templates.getRoot(), name);
    }

    FunctionApplicationNode plus(FunctionNode a, FunctionNode b) {
        return new FunctionApplicationNode(ctx, BuiltInFunctions.PLUS, Arrays.asList(a, b));
    }

    @Test
    void replacingQualifierSubjectsLeavesSharedQualifiersAlone() {
        StorageNode x = storage("x");
        StorageNode y = storage("y");
        SingleQualifier q = SingleQualifier.onNode(x, true);
        Conjunction key = Conjunction.of(q);
        int hash = key.hashCode();
        QualifiersNode qualifiers = new QualifiersNode(ctx, Arrays.asList(key, Conjunction.of()));

        qualifiers.replaceInputs(n -> n == x ? y : n);
        assertSame(x, q.getSubject());
        assertEquals(hash, key.hashCode());
        assertEquals(Conjunction.of(SingleQualifier.onNode(y, true)), qualifiers.getGuards().get(0));
        assertEquals(Collections.singletonList(y), qualifiers.getInputs());
    }

    @Test
    void equalNodesAreShared() {
        FunctionNode a = ctx.cache(storage("a"));
        FunctionNode first = ctx.cache(plus(a, new ConstNode(ctx, 1)));
        FunctionNode second = ctx.cache(plus(storage("a"), new ConstNode(ctx, 1.0)));
        assertSame(first, second);
        assertEquals(first.getId(), second.getId());
        assertSame(a, first.getInputs().get(0));
        assertEquals(3, ctx.size());
        assertEquals(2, ctx.getCache(Scope.template(1)).size());
        assertEquals(1, ctx.getCache(Scope.GLOBAL).size());
    }

    @Test
    void uncachedDuplicatesResolveToTheCachedNode() {
        FunctionNode a = ctx.cache(storage("a"));
        FunctionApplicationNode dup = plus(a, a);
        FunctionNode cached = ctx.cache(plus(a, a));
        assertSame(cached, ctx.cache(dup));
        assertSame(cached, dup.resolve());
        assertFalse(dup.isCached());
    }

    @Test
    void differentArgumentOrderIsADifferentNode() {
        FunctionNode a = ctx.cache(storage("a"));
        FunctionNode b = ctx.cache(storage("b"));
        assertNotSame(ctx.cache(plus(a, b)), ctx.cache(plus(b, a)));
    }

    @Test
    void constantFolding() {
        FunctionNode folded = plus(new ConstNode(ctx, 1), new ConstNode(ctx, 2)).simplify(ctx);
        assertTrue(folded instanceof ConstNode);
        assertEquals(3.0, ((ConstNode) folded).getValue());
        FunctionApplicationNode open = plus(storage("a"), new ConstNode(ctx, 2));
        assertSame(open, open.simplify(ctx));
    }

    @Test
    void scheduleSteps() {
        FunctionNode a = ctx.cache(storage("a"));
        FunctionNode inner = ctx.cache(plus(storage("b"), storage("c")));
        FunctionNode outer = ctx.cache(plus(a, inner));
        assertEquals(0, a.getScheduleStep());
        assertEquals(1, inner.getScheduleStep());
        assertEquals(2, outer.getScheduleStep());
        FunctionNode withConstant = ctx.cache(plus(outer, new ConstNode(ctx, 5)));
        assertEquals(3, withConstant.getScheduleStep());
        assertEquals(0, ctx.cache(new ConstNode(ctx, 5)).getScheduleStep());
    }

    @Test
    void higherPriorityInputsRunFirst() {
        StorageNode queue = new StorageNode(ctx, StorageNode.StorageKind.QUEUE, Scope.GLOBAL,
                Collections.singletonList("message"), null, ValueType.UNKNOWN);
        FunctionNode sum = ctx.cache(plus(queue, storage("b")));
        assertEquals(FunctionNode.PRIORITY_INPUT, queue.getPriority());
        assertEquals(FunctionNode.PRIORITY_DEFAULT, sum.getPriority());
        assertEquals(1, sum.getScheduleStep());
        assertEquals(0, ctx.getDiagnostics().count(Diagnostic.Kind.SCHEDULING_ORDER));
    }

    @Test
    void priorityWidensThroughInputs() {
        FunctionNode inner = ctx.cache(plus(storage("a"), new ConstNode(ctx, 1)));
        assertEquals(1, inner.getScheduleStep());
        FunctionNode outer = ctx.cache(new FunctionApplicationNode(ctx, BuiltInFunctions.IDENTITY,
                Collections.singletonList(inner), FunctionNode.PRIORITY_INPUT));
        assertEquals(FunctionNode.PRIORITY_INPUT, inner.getPriority());
        assertEquals(0, inner.getScheduleStep());
        assertEquals(1, outer.getScheduleStep());
        assertEquals(FunctionNode.PRIORITY_DEFAULT, inner.getInputs().get(0).getPriority());
    }

    @Test
    void storageCannotBeWidened() {
        FunctionNode a = ctx.cache(storage("a"));
        FunctionNode early = ctx.cache(new FunctionApplicationNode(ctx, BuiltInFunctions.IDENTITY,
                Collections.singletonList(a), FunctionNode.PRIORITY_INPUT));
        assertEquals(FunctionNode.PRIORITY_DEFAULT, a.getPriority());
        assertEquals(1, ctx.getDiagnostics().count(Diagnostic.Kind.SCHEDULING_ORDER));
        assertFalse(ctx.getDiagnostics().hasErrors());
        assertTrue(early.hasSchedulingError());
        assertTrue(a.hasSchedulingError());
    }

    @Test
    void strictSchedulingFails() {
        ctx = new GraphContext(GraphOptions.DEFAULT.withStrictScheduling(true), templates);
        FunctionNode a = ctx.cache(storage("a"));
        CompilationException e = assertThrows(CompilationException.class, () ->
                ctx.cache(new FunctionApplicationNode(ctx, BuiltInFunctions.IDENTITY,
                        Collections.singletonList(a), FunctionNode.PRIORITY_INPUT)));
        assertEquals(Diagnostic.Kind.SCHEDULING_ORDER, e.getDiagnostic().kind);
    }

    @Test
    void nestedScopesMerge() {
        AreaTemplate child = templates.addChild(templates.getRoot(), "child");
        FunctionNode sum = ctx.cache(plus(storage("a"), storage(child, "b")));
        assertEquals(Scope.template(child.id), sum.getScope());
        assertEquals(Scope.GLOBAL, ctx.cache(new ConstNode(ctx, "x")).getScope());
    }

    @Test
    void siblingScopesDoNotMerge() {
        AreaTemplate left = templates.addChild(templates.getRoot(), "left");
        AreaTemplate right = templates.addChild(templates.getRoot(), "right");
        StorageNode l = storage(left, "l");
        StorageNode r = storage(right, "r");
        ScopeIncompatibilityException e = assertThrows(ScopeIncompatibilityException.class, () -> plus(l, r));
        assertEquals(Diagnostic.Kind.SCOPE_INCOMPATIBILITY, e.getDiagnostic().kind);
    }

    @Test
    void inconsistentTypesAreFatal() {
        ctx.cache(new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                Collections.singletonList("t"), null, ValueType.single(ValueType.Base.NUMBER)));
        InconsistentCacheException e = assertThrows(InconsistentCacheException.class, () ->
                ctx.cache(new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                        Collections.singletonList("t"), null, ValueType.single(ValueType.Base.STRING))));
        assertEquals(Diagnostic.Kind.INCONSISTENT_CACHE, e.getDiagnostic().kind);
    }

    @Test
    void selfReferenceIsACycle() {
        StubNode stub = new StubNode(ctx, Scope.template(1), "screenArea:loop");
        FunctionApplicationNode loop = plus(stub, new ConstNode(ctx, 1));
        stub.resolveTo(loop);
        CycleException e = assertThrows(CycleException.class, () -> ctx.cache(loop));
        assertFalse(e.getTrace().isEmpty());
        assertEquals(0, ctx.getProbes().depth());
        assertFalse(loop.isCached());
    }

    @Test
    void unresolvedReferencesArePending() {
        StubNode stub = new StubNode(ctx, Scope.template(1), "screenArea:later");
        FunctionApplicationNode waiting = plus(stub, new ConstNode(ctx, 1));
        CacheResult result = ctx.internalize(waiting);
        assertFalse(result.isCached());
        assertEquals(stub.getSeqNr(), result.getSignal().seqNr);
        assertFalse(waiting.isCached());

        stub.resolveTo(ctx.cache(storage("a")));
        assertTrue(ctx.internalize(waiting).isCached());
    }

    @Test
    void generations() {
        int g = ctx.getGeneration();
        assertEquals(g + 1, ctx.nextGeneration());
        FunctionNode a = ctx.cache(storage("a"));
        assertFalse(a.isWritable(ctx));
        a.markWritable(ctx);
        assertTrue(a.isWritable(ctx));
        assertTrue(a.markQueued(ctx));
        assertFalse(a.markQueued(ctx));
        ctx.nextGeneration();
        assertFalse(a.isWritable(ctx));
        assertTrue(a.markQueued(ctx));
    }
}
