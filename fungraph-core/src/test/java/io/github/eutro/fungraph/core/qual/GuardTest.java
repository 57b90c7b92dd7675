package io.github.eutro.fungraph.core.qual;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.graph.StorageNode;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import io.github.eutro.fungraph.core.types.ValueType;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class GuardTest {
    final GraphContext ctx = new GraphContext(GraphOptions.DEFAULT, new TemplateTree());

    SingleQualifier q(String attribute, Object value) {
        StorageNode subject = new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                Collections.singletonList(attribute), null, ValueType.UNDEFINED);
        return new SingleQualifier(subject, attribute, value, 1);
    }

    @Test
    void complementaryTermsMerge() {
        Guard g = Guard.of(Conjunction.of(q("x", true)), Conjunction.of(q("x", false)));
        assertTrue(g.simplify().isTrue());
    }

    @Test
    void mergesCascade() {
        Guard g = Guard.of(
                Conjunction.of(q("a", true), q("b", true)),
                Conjunction.of(q("a", true), q("b", false)),
                Conjunction.of(q("a", false)));
        assertTrue(g.simplify().isTrue());
    }

    @Test
    void strongerTermsAreDropped() {
        Guard g = Guard.of(Conjunction.of(q("a", 1), q("b", 1)), Conjunction.of(q("a", true)));
        assertEquals(Guard.of(Conjunction.of(q("a", true))), g.simplify());
    }

    @Test
    void unrelatedTermsStay() {
        Guard g = Guard.of(Conjunction.of(q("a", true), q("b", true)), Conjunction.of(q("a", false)));
        assertSame(g, g.simplify());
        assertEquals(2, g.simplify().getTerms().size());
    }

    @Test
    void simplifyIsIdempotent() {
        Guard[] guards = {
                Guard.of(Conjunction.of(q("a", 1)), Conjunction.of(q("a", 2)), Conjunction.of(q("a", true))),
                Guard.of(Conjunction.of(q("a", true), q("c", 3)), Conjunction.of(q("a", false), q("c", 3))),
                Guard.of(Conjunction.of(q("b", false)), Conjunction.of(q("b", 1), q("a", 1))),
                Guard.FALSE,
                Guard.TRUE,
        };
        for (Guard g : guards) {
            Guard once = g.simplify();
            assertEquals(once, once.simplify(), g::toString);
        }
    }

    @Test
    void orIgnoresDuplicates() {
        Guard g = Guard.of(Conjunction.of(q("a", 1)));
        assertSame(g, g.or(Conjunction.of(q("a", 1.0))));
        assertEquals(2, g.or(Guard.of(Conjunction.of(q("b", 1)))).getTerms().size());
    }

    @Test
    void evaluation() {
        Guard g = Guard.of(Conjunction.of(q("a", 1)), Conjunction.of(q("b", 1)));
        KnownQualifiers a1 = KnownQualifiers.of(Conjunction.of(q("a", 1)), Collections.emptyList());
        KnownQualifiers neither = KnownQualifiers.of(Conjunction.of(q("a", 2), q("b", 2)), Collections.emptyList());
        assertEquals(TriState.TRUE, g.evaluate(a1));
        assertEquals(TriState.FALSE, g.evaluate(neither));
        assertEquals(TriState.UNKNOWN, g.evaluate(KnownQualifiers.EMPTY));
        assertEquals(TriState.FALSE, Guard.FALSE.evaluate(KnownQualifiers.EMPTY));
        assertEquals(TriState.TRUE, Guard.TRUE.evaluate(KnownQualifiers.EMPTY));
    }
}
