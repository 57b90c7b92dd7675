package io.github.eutro.fungraph.core.qual;

import io.github.eutro.fungraph.core.graph.FunctionNode;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What is known at some point of the graph: qualifiers known to hold, and conjunctions
 * known not to hold (the guards of earlier alternatives that did not win).
 */
public final class KnownQualifiers {
    public static final KnownQualifiers EMPTY = new KnownQualifiers(Conjunction.TRUE, Collections.emptyList());

    private final Conjunction trueQs;
    private final List<Conjunction> falseQs;

    private KnownQualifiers(Conjunction trueQs, List<Conjunction> falseQs) {
        this.trueQs = trueQs;
        this.falseQs = falseQs;
    }

    public static KnownQualifiers of(Conjunction trueQs, List<Conjunction> falseQs) {
        return new KnownQualifiers(trueQs, Collections.unmodifiableList(new ArrayList<>(falseQs)));
    }

    public boolean isEmpty() {
        return trueQs.isTrue() && falseQs.isEmpty();
    }

    public Conjunction getTrueQualifiers() {
        return trueQs;
    }

    public List<Conjunction> getFalseConjunctions() {
        return falseQs;
    }

    /**
     * Additionally assume {@code c} holds.
     *
     * @param c The conjunction.
     * @return The new knowledge, or null if {@code c} contradicts what is known.
     */
    @Contract(pure = true)
    @Nullable
    public KnownQualifiers assume(Conjunction c) {
        if (c.isTrue()) return this;
        Conjunction nt = trueQs.and(c);
        if (nt == null) return null;
        return new KnownQualifiers(nt, falseQs);
    }

    /**
     * Additionally assume {@code c} does not hold.
     *
     * @param c The conjunction.
     * @return The new knowledge.
     */
    @Contract(pure = true)
    public KnownQualifiers assumeFalse(Conjunction c) {
        if (falseQs.contains(c)) return this;
        List<Conjunction> nf = new ArrayList<>(falseQs);
        nf.add(c);
        return new KnownQualifiers(trueQs, Collections.unmodifiableList(nf));
    }

    /**
     * The known-true qualifiers extended with {@code c}, ignoring contradictions.
     *
     * @param c The conjunction.
     * @return The combined conjunction.
     */
    Conjunction conjoin(Conjunction c) {
        Conjunction r = trueQs;
        for (SingleQualifier q : c) r = r.with(q);
        return r;
    }

    public TriState evaluate(SingleQualifier q) {
        for (SingleQualifier t : trueQs) {
            TriState s = q.impliedBy(t);
            if (s != TriState.UNKNOWN) return s;
        }
        for (Conjunction f : falseQs) {
            if (f.size() == 1 && f.get(0).impliedBy(q) == TriState.TRUE) {
                return TriState.FALSE;
            }
        }
        return TriState.UNKNOWN;
    }

    /**
     * The value of a node fixed by a known qualifier with a single literal value, if any.
     *
     * @param node The node.
     * @return The value.
     */
    public Optional<Object> knownValue(FunctionNode node) {
        for (SingleQualifier t : trueQs) {
            if (t.isLiteral() && t.hasSubject(node)) {
                return Optional.of(t.value);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KnownQualifiers that = (KnownQualifiers) o;
        return trueQs.equals(that.trueQs) && falseQs.equals(that.falseQs);
    }

    @Override
    public int hashCode() {
        return 31 * trueQs.hashCode() + falseQs.hashCode();
    }

    @Override
    public String toString() {
        return "known" + trueQs + (falseQs.isEmpty() ? "" : " not" + falseQs);
    }
}
