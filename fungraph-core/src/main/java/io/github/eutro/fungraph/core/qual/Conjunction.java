package io.github.eutro.fungraph.core.qual;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A list of qualifiers that must all hold. The empty conjunction is {@link #TRUE}.
 * <p>
 * Conjunctions never hold two semantically equal qualifiers, and equality between
 * conjunctions ignores order.
 */
public final class Conjunction implements Iterable<SingleQualifier> {
    public static final Conjunction TRUE = new Conjunction(Collections.emptyList());

    private final List<SingleQualifier> qualifiers;

    private Conjunction(List<SingleQualifier> qualifiers) {
        this.qualifiers = qualifiers;
    }

    public static Conjunction of(SingleQualifier... qualifiers) {
        return of(Arrays.asList(qualifiers));
    }

    public static Conjunction of(Collection<SingleQualifier> qualifiers) {
        if (qualifiers.isEmpty()) return TRUE;
        List<SingleQualifier> qs = new ArrayList<>(qualifiers.size());
        for (SingleQualifier q : qualifiers) {
            if (!qs.contains(q)) qs.add(q);
        }
        return new Conjunction(Collections.unmodifiableList(qs));
    }

    public boolean isTrue() {
        return qualifiers.isEmpty();
    }

    public int size() {
        return qualifiers.size();
    }

    public SingleQualifier get(int i) {
        return qualifiers.get(i);
    }

    public List<SingleQualifier> getQualifiers() {
        return qualifiers;
    }

    @NotNull
    @Override
    public Iterator<SingleQualifier> iterator() {
        return qualifiers.iterator();
    }

    public boolean contains(SingleQualifier q) {
        return qualifiers.contains(q);
    }

    /**
     * Combine with another conjunction.
     *
     * @param other The other conjunction.
     * @return The conjunction of both, or null if they contradict.
     */
    @Contract(pure = true)
    @Nullable
    public Conjunction and(Conjunction other) {
        if (other.isTrue()) return this;
        if (isTrue()) return other;
        List<SingleQualifier> qs = new ArrayList<>(qualifiers);
        for (SingleQualifier q : other) {
            for (SingleQualifier mine : qualifiers) {
                if (q.contradicts(mine)) return null;
            }
            if (!qs.contains(q)) qs.add(q);
        }
        return new Conjunction(Collections.unmodifiableList(qs));
    }

    /**
     * Whether this conjunction holding guarantees {@code other} holds, i.e. every qualifier of
     * {@code other} is implied by one in this conjunction.
     *
     * @param other The other conjunction.
     * @return Whether {@code this => other}.
     */
    public boolean implies(Conjunction other) {
        outer:
        for (SingleQualifier q : other) {
            for (SingleQualifier mine : qualifiers) {
                if (q.impliedBy(mine) == TriState.TRUE) continue outer;
            }
            return false;
        }
        return true;
    }

    /**
     * Evaluate this conjunction against what is known.
     *
     * @param known The known qualifiers.
     * @return The outcome.
     */
    public TriState evaluate(KnownQualifiers known) {
        TriState result = TriState.TRUE;
        for (SingleQualifier q : qualifiers) {
            result = result.and(known.evaluate(q));
            if (result == TriState.FALSE) return result;
        }
        if (result == TriState.UNKNOWN) {
            for (Conjunction f : known.getFalseConjunctions()) {
                if (known.conjoin(this).implies(f)) return TriState.FALSE;
            }
        }
        return result;
    }

    /**
     * Drop the qualifiers already known to hold.
     *
     * @param known The known qualifiers.
     * @return The remaining conjunction.
     */
    @Contract(pure = true)
    public Conjunction strip(KnownQualifiers known) {
        List<SingleQualifier> qs = new ArrayList<>(qualifiers.size());
        for (SingleQualifier q : qualifiers) {
            if (known.evaluate(q) != TriState.TRUE) qs.add(q);
        }
        return qs.size() == qualifiers.size() ? this : of(qs);
    }

    @Contract(pure = true)
    public Conjunction without(SingleQualifier q) {
        if (!contains(q)) return this;
        List<SingleQualifier> qs = new ArrayList<>(qualifiers);
        qs.remove(q);
        return of(qs);
    }

    @Contract(pure = true)
    public Conjunction with(SingleQualifier q) {
        if (contains(q)) return this;
        List<SingleQualifier> qs = new ArrayList<>(qualifiers);
        qs.add(q);
        return new Conjunction(Collections.unmodifiableList(qs));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conjunction that = (Conjunction) o;
        return qualifiers.size() == that.qualifiers.size() && qualifiers.containsAll(that.qualifiers);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (SingleQualifier q : qualifiers) h += q.hashCode();
        return h;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (SingleQualifier q : qualifiers) sj.add(q.toString());
        return sj.toString();
    }
}
