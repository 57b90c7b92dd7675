package io.github.eutro.fungraph.core.passes;

import io.github.eutro.fungraph.core.build.GraphBuilder;
import io.github.eutro.fungraph.core.build.WriteAction;
import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.graph.*;
import io.github.eutro.fungraph.core.passes.convert.ExportGraph;
import io.github.eutro.fungraph.core.passes.convert.GraphExport;
import io.github.eutro.fungraph.core.passes.meta.MarkWritables;
import io.github.eutro.fungraph.core.passes.misc.ChainedPass;
import io.github.eutro.fungraph.core.passes.opts.CompactGraph;
import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    final TemplateTree templates = new TemplateTree();
    final AreaTemplate root = templates.getRoot();
    final GraphBuilder b = new GraphBuilder(new GraphContext(GraphOptions.DEFAULT, templates));
    final GraphContext ctx = b.getContext();

    @Test
    void writablesFollowWriteThroughInputs() {
        StorageNode x = b.areaState(root, "x", null);
        FunctionNode passThrough = b.apply(BuiltInFunctions.IDENTITY, x);
        FunctionNode sum = b.apply(BuiltInFunctions.PLUS, x, b.constant(1));
        b.addRoot(sum);
        WriteAction write = b.write("set", b.messageQueue(), passThrough, b.constant(5));
        b.complete();

        MarkWritables.INSTANCE.run(ctx);
        assertTrue(x.isWritable(ctx));
        assertTrue(passThrough.resolve().isWritable(ctx));
        assertFalse(sum.isWritable(ctx));
        assertFalse(write.isNoOp());
        assertEquals(1, write.getDestinations().size());
        assertSame(x, write.getDestinations().get(0).storage);

        ctx.nextGeneration();
        assertFalse(x.isWritable(ctx));
        MarkWritables.INSTANCE.run(ctx);
        assertTrue(x.isWritable(ctx));
    }

    @Test
    void writeOutputPathIsPerGeneration() {
        StorageNode x = b.areaState(root, "x", null);
        FunctionNode passThrough = b.apply(BuiltInFunctions.IDENTITY, x);
        FunctionNode sum = b.apply(BuiltInFunctions.PLUS, x, b.constant(1));
        b.addRoot(sum);
        b.write("set", b.messageQueue(), passThrough, b.constant(5));
        b.complete();

        MarkWritables.INSTANCE.run(ctx);
        assertTrue(passThrough.resolve().isOnWriteOutputPath(ctx));
        assertFalse(sum.isOnWriteOutputPath(ctx));

        ctx.nextGeneration();
        assertFalse(passThrough.resolve().isOnWriteOutputPath(ctx));
        MarkWritables.INSTANCE.run(ctx);
        assertTrue(passThrough.resolve().isOnWriteOutputPath(ctx));
    }

    @Test
    void compactionDropsUnreachableNodes() {
        StorageNode x = b.areaState(root, "x", null);
        FunctionNode orphan = b.apply(BuiltInFunctions.PLUS, x, b.constant(2));
        FunctionNode kept = b.apply(BuiltInFunctions.MUL, x, b.constant(3));
        b.addRoot(kept);
        b.complete();
        assertEquals(2, kept.getId());

        CompactGraph.INSTANCE.run(ctx);
        assertEquals(FunctionNode.COMPACTED, orphan.getId());
        assertFalse(orphan.isCached());
        assertEquals(0, x.getId());
        assertEquals(1, kept.getId());
        assertEquals(2, ctx.getCache(Scope.template(root.id)).size());
        assertEquals(1, ctx.getCache(Scope.GLOBAL).size());
    }

    @Test
    void exportLines() {
        StorageNode x = b.areaState(root, "x", null);
        b.addRoot(b.apply(BuiltInFunctions.PLUS, x, b.constant(1)));
        b.complete();

        GraphExport export = Passes.EXPORT.run(ctx);
        assertEquals(Arrays.asList(Scope.GLOBAL, Scope.template(root.id)), Arrays.asList(export.getScopes().toArray()));
        assertEquals(Arrays.asList("0/0 p0 s0 0:const(1)"), export.getLines(Scope.GLOBAL));
        assertEquals(Arrays.asList(
                "1/0 p0 s0 0:storage(plain,\"screenArea.x\")",
                "1/0 p0 s1 1:apply(plus,[0,0],[-1,0])"
        ), export.getLines(Scope.template(root.id)));
        assertEquals(3, export.size());
        assertTrue(export.getLines(Scope.template(42)).isEmpty());
        assertTrue(export.toString().startsWith("scope global\n  0/0"));
    }

    @Test
    void referencesCountTemplateLevels() {
        AreaTemplate item = templates.addChild(root, "item");
        StorageNode x = b.areaState(root, "x", null);
        StorageNode y = b.areaState(item, "y", null);
        FunctionNode one = b.constant(1);
        FunctionNode sum = b.apply(BuiltInFunctions.PLUS, x, y);
        assertEquals(Scope.template(item.id), sum.getScope());

        assertEquals("[1," + x.getId() + "]", ExportGraph.reference(templates, sum, x));
        assertEquals("[0," + y.getId() + "]", ExportGraph.reference(templates, sum, y));
        assertEquals("[-1," + one.getId() + "]", ExportGraph.reference(templates, sum, one));
        assertThrows(IllegalStateException.class,
                () -> ExportGraph.reference(templates, sum, new ConstNode(ctx, "uncached")));
    }

    @Test
    void closureReferencesNameTheirClosure() {
        StorageNode x = b.areaState(root, "x", null);
        ClosureNode inc = b.closure(Scope.template(root.id), 1,
                params -> b.apply(BuiltInFunctions.PLUS, params.get(0), x));
        b.complete();
        FunctionNode body = inc.getBody(ctx).resolve();
        assertEquals(inc.getBodyScope(), body.getScope());
        assertEquals("[0," + x.getId() + "," + Scope.NO_CLOSURE + "]", ExportGraph.reference(templates, body, x));
        StorageNode param = inc.getParams().get(0);
        assertEquals("[0," + param.getId() + "]", ExportGraph.reference(templates, body, param));
    }

    @Test
    void chainsFlattenInOrder() {
        IRPass<String, Integer> length = String::length;
        IRPass<Integer, Integer> inc = i -> i + 1;
        IRPass<Integer, String> show = String::valueOf;
        IRPass<String, String> chain = length.then(inc).then(show);
        assertTrue(chain instanceof ChainedPass);
        List<IRPass<Object, Object>> passes = ((ChainedPass<?, ?, ?>) chain).listPasses();
        assertEquals(Arrays.<Object>asList(length, inc, show), passes);
        assertEquals("4", chain.run("abc"));
        assertFalse(chain.isInPlace());
        assertTrue(Passes.FINISH_GRAPH.isInPlace());
    }

    @Test
    void chainFailuresNameThePass() {
        IRPass<String, Integer> length = String::length;
        IRPass<Integer, Integer> fail = i -> {
            throw new IllegalStateException("boom");
        };
        IRPass<String, Integer> chain = length.then(fail);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run("abc"));
        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 1 in chain", e.getSuppressed()[0].getMessage());
    }
}
