package io.github.eutro.fungraph.api;

import io.github.eutro.fungraph.api.events.*;
import io.github.eutro.fungraph.core.build.ContextDefinition;
import io.github.eutro.fungraph.core.build.GraphBuilder;
import io.github.eutro.fungraph.core.build.VariantTerm;
import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.diag.CycleException;
import io.github.eutro.fungraph.core.diag.Diagnostic;
import io.github.eutro.fungraph.core.graph.BuiltInFunctions;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.passes.IRPass;
import io.github.eutro.fungraph.core.passes.convert.GraphExport;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GraphCompilationTest {
    final TemplateTree templates = new TemplateTree();

    static void buildSum(BuildGraphEvent evt) {
        GraphBuilder b = evt.builder;
        b.addRoot(b.apply(BuiltInFunctions.PLUS, b.areaState(b.getContext().getTemplates().getRoot(), "x", null), b.constant(1)));
    }

    @Test
    void eventsFireInOrder() {
        GraphCompiler compiler = new GraphCompiler();
        List<String> events = new ArrayList<>();
        compiler.listen(RunGraphCompilationEvent.class, evt -> events.add("run"));
        EventDispatcher<GraphCompileEvent> all = compiler.lift();
        all.listen(BuildGraphEvent.class, evt -> {
            events.add("build");
            buildSum(evt);
        });
        all.listen(GraphPassesEvent.class, evt -> events.add("passes"));
        all.listen(EmitExportEvent.class, evt -> events.add("emit"));
        List<GraphExport> exports = compiler.exportsAsList();

        GraphCompilation compilation = compiler.submit(templates);
        assertNull(compilation.getGraph());
        GraphExport export = compilation.run();

        assertEquals(Arrays.asList("run", "build", "passes", "emit"), events);
        assertEquals(1, exports.size());
        assertSame(export, exports.get(0));
        assertEquals(3, export.size());
        assertEquals(Arrays.asList(
                "1/0 p0 s0 0:storage(plain,\"screenArea.x\")",
                "1/0 p0 s1 1:apply(plus,[0,0],[-1,0])"
        ), export.getLines(Scope.template(templates.getRoot().id)));
        assertNotNull(compilation.getGraph());
        assertEquals(1, compilation.getGraph().getGeneration());
    }

    @Test
    void listenersCanExtendThePasses() {
        GraphCompiler compiler = new GraphCompiler();
        boolean[] ran = {false};
        IRPass<GraphContext, GraphContext> extra = ctx -> {
            ran[0] = true;
            return ctx;
        };
        compiler.lift().listen(GraphPassesEvent.class, evt -> evt.passes = evt.passes.then(extra));
        compiler.submit(templates).run();
        assertTrue(ran[0]);
    }

    @Test
    void cancelledExportsAreNotCollected() {
        GraphCompiler compiler = new GraphCompiler();
        compiler.lift().listen(EmitExportEvent.class, EmitExportEvent::cancel);
        List<GraphExport> exports = compiler.exportsAsList();
        GraphExport export = compiler.submit(templates).run();
        assertNotNull(export);
        assertTrue(exports.isEmpty());
    }

    @Test
    void warningsAreDelivered() {
        GraphCompiler compiler = new GraphCompiler();
        List<Diagnostic> diagnostics = new ArrayList<>();
        compiler.lift().listen(DiagnosticEvent.class, evt -> diagnostics.add(evt.diagnostic));
        compiler.lift().listen(BuildGraphEvent.class, evt -> {
            GraphBuilder b = evt.builder;
            b.write("toConstant", b.messageQueue(), b.constant(1), b.constant(2));
        });
        GraphCompilation compilation = compiler.submit(templates);
        compilation.run();
        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.UNSUPPORTED_WRITE_TARGET, diagnostics.get(0).kind);
        assertFalse(diagnostics.get(0).isFatal());
        assertEquals(diagnostics, compilation.getDiagnostics().getReported());
    }

    @Test
    void cyclesAreReportedOnce() {
        templates.getRoot().defineContext("a", (b, t, k) -> b.definingVariant(t, Arrays.asList(
                VariantTerm.when("a", 1, (b2, t2, k2) -> b2.areaState(t2, "s", null)),
                VariantTerm.always(ContextDefinition.constant(2))), k));
        GraphCompiler compiler = new GraphCompiler(GraphOptions.DEFAULT.withOptimize(false));
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<GraphExport> exports = compiler.exportsAsList();
        compiler.lift().listen(DiagnosticEvent.class, evt -> diagnostics.add(evt.diagnostic));

        GraphCompilation compilation = compiler.submit(templates);
        assertThrows(CycleException.class, compilation::run);
        int cycles = 0;
        for (Diagnostic d : diagnostics) {
            if (d.kind == Diagnostic.Kind.STRUCTURAL_CYCLE) cycles++;
        }
        assertEquals(1, cycles);
        assertTrue(compilation.getDiagnostics().hasErrors());
        assertTrue(exports.isEmpty());
    }
}
