package io.github.eutro.fungraph.core.qual;

import org.jetbrains.annotations.Contract;

import java.util.*;

/**
 * A disjunction of {@link Conjunction}s: the guard holds if any of them holds.
 * The empty guard is {@link #FALSE}.
 */
public final class Guard {
    public static final Guard FALSE = new Guard(Collections.emptyList());
    public static final Guard TRUE = new Guard(Collections.singletonList(Conjunction.TRUE));

    private final List<Conjunction> terms;

    private Guard(List<Conjunction> terms) {
        this.terms = terms;
    }

    public static Guard of(Conjunction... terms) {
        Guard g = FALSE;
        for (Conjunction c : terms) g = g.or(c);
        return g;
    }

    public List<Conjunction> getTerms() {
        return terms;
    }

    public boolean isTrue() {
        return terms.size() == 1 && terms.get(0).isTrue();
    }

    public boolean isFalse() {
        return terms.isEmpty();
    }

    /**
     * Add a conjunction, unless an equal one is already present.
     *
     * @param c The conjunction.
     * @return The extended guard.
     */
    @Contract(pure = true)
    public Guard or(Conjunction c) {
        if (terms.contains(c)) return this;
        List<Conjunction> nt = new ArrayList<>(terms);
        nt.add(c);
        return new Guard(Collections.unmodifiableList(nt));
    }

    @Contract(pure = true)
    public Guard or(Guard other) {
        Guard g = this;
        for (Conjunction c : other.terms) g = g.or(c);
        return g;
    }

    /**
     * Merge pairs of conjunctions that differ only in one boolean qualifier, and drop conjunctions
     * implied by another, until nothing changes.
     *
     * @return The simplified guard.
     */
    @Contract(pure = true)
    public Guard simplify() {
        List<Conjunction> ts = new ArrayList<>(terms);
        boolean changed = true;
        while (changed) {
            changed = false;
            search:
            for (int i = 0; i < ts.size(); i++) {
                for (int j = 0; j < ts.size(); j++) {
                    if (i == j) continue;
                    Conjunction a = ts.get(i);
                    Conjunction b = ts.get(j);
                    if (a.implies(b)) {
                        // b is weaker, a adds nothing
                        ts.remove(i);
                        changed = true;
                        break search;
                    }
                    Conjunction merged = mergeComplementary(a, b);
                    if (merged != null) {
                        ts.set(i, merged);
                        ts.remove(j);
                        changed = true;
                        break search;
                    }
                }
            }
        }
        if (ts.size() == terms.size() && ts.equals(terms)) return this;
        return new Guard(Collections.unmodifiableList(ts));
    }

    private static Conjunction mergeComplementary(Conjunction a, Conjunction b) {
        if (a.size() != b.size()) return null;
        SingleQualifier differing = null;
        for (SingleQualifier q : a) {
            if (b.contains(q)) continue;
            if (differing != null) return null;
            differing = q;
        }
        if (differing == null) return null;
        for (SingleQualifier q : b) {
            if (!a.contains(q)) {
                return q.isComplementOf(differing) ? a.without(differing) : null;
            }
        }
        return null;
    }

    public TriState evaluate(KnownQualifiers known) {
        TriState result = TriState.FALSE;
        for (Conjunction c : terms) {
            result = result.or(c.evaluate(known));
            if (result == TriState.TRUE) return result;
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Guard guard = (Guard) o;
        return terms.size() == guard.terms.size() && terms.containsAll(guard.terms);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Conjunction c : terms) h += c.hashCode();
        return h;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(" | ", "[", "]");
        for (Conjunction c : terms) sj.add(c.toString());
        return sj.toString();
    }
}
