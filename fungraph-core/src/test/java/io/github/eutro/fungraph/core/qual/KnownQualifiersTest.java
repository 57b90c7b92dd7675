package io.github.eutro.fungraph.core.qual;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.graph.GraphContext;
import io.github.eutro.fungraph.core.graph.StorageNode;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import io.github.eutro.fungraph.core.types.ValueType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class KnownQualifiersTest {
    final GraphContext ctx = new GraphContext(GraphOptions.DEFAULT, new TemplateTree());
    final StorageNode a = storage("a");
    final StorageNode b = storage("b");

    StorageNode storage(String name) {
        return new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                Collections.singletonList(name), null, ValueType.UNDEFINED);
    }

    SingleQualifier q(StorageNode subject, Object value) {
        return new SingleQualifier(subject, subject.getPath().get(0), value, 1);
    }

    @Test
    void emptiness() {
        assertTrue(KnownQualifiers.EMPTY.isEmpty());
        assertFalse(KnownQualifiers.EMPTY.assumeFalse(Conjunction.of(q(a, 1))).isEmpty());
        assertSame(KnownQualifiers.EMPTY, KnownQualifiers.EMPTY.assume(Conjunction.TRUE));
    }

    @Test
    void contradictoryAssumptions() {
        KnownQualifiers known = KnownQualifiers.EMPTY.assume(Conjunction.of(q(a, 1)));
        assertNotNull(known);
        assertNull(known.assume(Conjunction.of(q(a, 2))));
        assertNull(known.assume(Conjunction.of(q(b, 1), q(a, false))));
        assertNotNull(known.assume(Conjunction.of(q(b, 1))));
    }

    @Test
    void falseConjunctionsAreKeptOnce() {
        KnownQualifiers known = KnownQualifiers.EMPTY.assumeFalse(Conjunction.of(q(a, 1)));
        assertSame(known, known.assumeFalse(Conjunction.of(q(a, 1.0))));
        assertEquals(1, known.getFalseConjunctions().size());
    }

    @Test
    void singleFalseQualifiers() {
        KnownQualifiers known = KnownQualifiers.EMPTY.assumeFalse(Conjunction.of(q(a, Arrays.asList(1, 2))));
        assertEquals(TriState.FALSE, known.evaluate(q(a, 1)));
        assertEquals(TriState.UNKNOWN, known.evaluate(q(a, 3)));
        assertEquals(TriState.UNKNOWN, known.evaluate(q(b, 1)));
    }

    @Test
    void knownValues() {
        KnownQualifiers known = KnownQualifiers.of(Conjunction.of(q(a, 3), q(b, Arrays.asList(1, 2))),
                Collections.emptyList());
        assertEquals(Optional.of(3.0), known.knownValue(a));
        assertEquals(Optional.empty(), known.knownValue(b));
        assertEquals(Optional.empty(), known.knownValue(storage("c")));
    }

    @Test
    void equality() {
        KnownQualifiers one = KnownQualifiers.EMPTY.assume(Conjunction.of(q(a, 1), q(b, 2)));
        KnownQualifiers other = KnownQualifiers.EMPTY.assume(Conjunction.of(q(b, 2), q(a, 1)));
        assertEquals(one, other);
        assertEquals(one.hashCode(), other.hashCode());
        assertNotEquals(one, one.assumeFalse(Conjunction.of(q(a, 5))));
    }
}
