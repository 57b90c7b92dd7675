package io.github.eutro.fungraph.core.qual;

import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.types.RangeValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A predicate "the context attribute {@code attribute} of template {@code template} compares to {@code value}".
 * <p>
 * The value is a simple literal, an ordered set of literals (any element matches) or a {@link RangeValue}.
 * Qualifiers built for conditions on arbitrary nodes (see {@link #onNode(FunctionNode, Object)}) have no
 * attribute and are identified by their subject node instead.
 * <p>
 * Equality is semantic: two qualifiers are equal when they test the same attribute (or node) against
 * the same value, whatever node was built to compute the attribute.
 */
public final class SingleQualifier {
    /**
     * The node computing the attribute's value. It may still be a forward reference while the
     * attribute is being built.
     */
    @NotNull
    private final FunctionNode subject;
    @Nullable
    public final String attribute;
    @NotNull
    public final Object value;
    public final int template;

    public SingleQualifier(@NotNull FunctionNode subject, @Nullable String attribute, @NotNull Object value, int template) {
        this.subject = subject;
        this.attribute = attribute;
        this.value = normalize(value);
        this.template = template;
    }

    /**
     * A qualifier on an anonymous node, e.g. the selector of a {@code cond} or the condition of a boolean gate.
     *
     * @param subject The node.
     * @param value   The value it is compared to.
     * @return The qualifier.
     */
    public static SingleQualifier onNode(@NotNull FunctionNode subject, @NotNull Object value) {
        return new SingleQualifier(subject, null, value, subject.getScope().template);
    }

    private static Object normalize(Object value) {
        if (value instanceof Number && !(value instanceof Double)) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof List && ((List<?>) value).size() == 1) {
            return normalize(((List<?>) value).get(0));
        }
        return value;
    }

    @NotNull
    public FunctionNode getSubject() {
        return subject.resolve();
    }

    /**
     * A copy of this qualifier with a different subject node.
     *
     * @param subject The new subject.
     * @return The copy.
     */
    public SingleQualifier withSubject(@NotNull FunctionNode subject) {
        return new SingleQualifier(subject, attribute, value, template);
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    /**
     * Whether the value is a single literal, so a match fixes the attribute's value.
     *
     * @return Whether the value is neither a set nor a range.
     */
    public boolean isLiteral() {
        return !(value instanceof List) && !(value instanceof RangeValue);
    }

    /**
     * Whether this tests the same attribute (or node) as {@code other}.
     *
     * @param other The other qualifier.
     * @return Whether the subjects are the same.
     */
    public boolean sameSubject(SingleQualifier other) {
        if (attribute != null || other.attribute != null) {
            return template == other.template && Objects.equals(attribute, other.attribute);
        }
        return getSubject() == other.getSubject();
    }

    /**
     * Whether this qualifier tests the value of the given node.
     *
     * @param node The node.
     * @return Whether it is the subject.
     */
    public boolean hasSubject(FunctionNode node) {
        return getSubject() == node.resolve();
    }

    /**
     * Whether a concrete value of the attribute satisfies this qualifier.
     *
     * @param actual The attribute's value.
     * @return Whether the qualifier holds.
     */
    public boolean matches(@Nullable Object actual) {
        return matchesPattern(value, actual);
    }

    /**
     * Whether a value matches a pattern: a boolean tests truthiness, an ordered set matches any of
     * its elements, a range matches the values it contains, and anything else must be equal.
     *
     * @param pattern The pattern.
     * @param actual  The value.
     * @return Whether it matches.
     */
    public static boolean matchesPattern(@NotNull Object pattern, @Nullable Object actual) {
        Object p = normalize(pattern);
        Object v = normalize(actual);
        if (p instanceof Boolean) {
            return (Boolean) p == isTrue(v);
        } else if (p instanceof List) {
            for (Object elt : (List<?>) p) {
                if (Objects.equals(normalize(elt), v)) return true;
            }
            return false;
        } else if (p instanceof RangeValue) {
            return ((RangeValue) p).contains(v);
        }
        return p.equals(v);
    }

    /**
     * The truthiness of a value: everything but {@code false}, {@code null} and {@code o()} is true.
     *
     * @param v The value.
     * @return Whether it counts as true.
     */
    public static boolean isTrue(@Nullable Object v) {
        if (v == null || Boolean.FALSE.equals(v)) return false;
        if (v instanceof List) {
            for (Object elt : (List<?>) v) {
                if (isTrue(elt)) return true;
            }
            return false;
        }
        return true;
    }

    /**
     * Evaluate this qualifier assuming {@code known} holds.
     *
     * @param known A qualifier known to be true.
     * @return Whether this qualifier then holds, fails, or is undetermined.
     */
    public TriState impliedBy(SingleQualifier known) {
        if (!sameSubject(known)) return TriState.UNKNOWN;
        if (equals(known)) return TriState.TRUE;
        Object kv = known.value;
        if (known.isLiteral()) {
            if (kv instanceof Boolean && !(value instanceof Boolean)) {
                // "attr: true" only says the attribute is not empty
                return Boolean.FALSE.equals(kv) && !matches(null) ? TriState.FALSE : TriState.UNKNOWN;
            }
            return TriState.of(matches(kv));
        }
        if (kv instanceof List) {
            boolean all = true;
            boolean none = true;
            for (Object elt : (List<?>) kv) {
                if (matches(elt)) {
                    none = false;
                } else {
                    all = false;
                }
            }
            return all ? TriState.TRUE : none ? TriState.FALSE : TriState.UNKNOWN;
        }
        RangeValue kr = (RangeValue) kv;
        if (value instanceof RangeValue) {
            RangeValue r = (RangeValue) value;
            if (r.includes(kr)) return TriState.TRUE;
            if (r.isDisjoint(kr)) return TriState.FALSE;
        } else if (value instanceof Boolean) {
            // a range value is never empty
            return TriState.of((Boolean) value);
        }
        return TriState.UNKNOWN;
    }

    /**
     * Whether this and {@code other} can never hold together.
     *
     * @param other The other qualifier.
     * @return Whether they contradict.
     */
    public boolean contradicts(SingleQualifier other) {
        return impliedBy(other) == TriState.FALSE || other.impliedBy(this) == TriState.FALSE;
    }

    /**
     * Whether this is a boolean qualifier on the same subject as {@code other} with the opposite value.
     *
     * @param other The other qualifier.
     * @return Whether the two are complementary.
     */
    public boolean isComplementOf(SingleQualifier other) {
        return isBoolean() && other.isBoolean() && sameSubject(other) && !value.equals(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SingleQualifier that = (SingleQualifier) o;
        return sameSubject(that) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        int subjectHash = attribute != null
                ? 31 * template + attribute.hashCode()
                : System.identityHashCode(getSubject());
        return 31 * subjectHash + value.hashCode();
    }

    @Override
    public String toString() {
        String name = attribute != null ? attribute + "@" + template : "#" + getSubject().getSeqNr();
        return name + ":" + value;
    }
}
