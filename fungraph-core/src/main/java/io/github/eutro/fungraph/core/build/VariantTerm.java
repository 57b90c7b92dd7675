package io.github.eutro.fungraph.core.build;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * One alternative of a variant definition: a list of qualifiers on context attributes,
 * and the expression that applies when all of them hold.
 */
public final class VariantTerm {
    /**
     * A qualifier as written in a definition: a context attribute of the template
     * {@code level} steps up, and the value it should match.
     */
    public static final class QualifierTerm {
        public final String attribute;
        public final Object value;
        public final int level;

        public QualifierTerm(@NotNull String attribute, @NotNull Object value, int level) {
            if (level < 0) throw new IllegalArgumentException("negative level " + level);
            this.attribute = attribute;
            this.value = value;
            this.level = level;
        }

        public QualifierTerm(@NotNull String attribute, @NotNull Object value) {
            this(attribute, value, 0);
        }

        @Override
        public String toString() {
            return (level == 0 ? "" : "^" + level) + attribute + ":" + value;
        }
    }

    public final List<QualifierTerm> qualifiers;
    public final ContextDefinition value;

    public VariantTerm(List<QualifierTerm> qualifiers, ContextDefinition value) {
        this.qualifiers = Collections.unmodifiableList(new ArrayList<>(qualifiers));
        this.value = value;
    }

    /**
     * An alternative with no qualifiers, which always applies.
     *
     * @param value The expression.
     * @return The term.
     */
    public static VariantTerm always(ContextDefinition value) {
        return new VariantTerm(Collections.emptyList(), value);
    }

    /**
     * An alternative with one qualifier on the template's own context.
     *
     * @param attribute The context attribute.
     * @param match     The value it should match.
     * @param value     The expression.
     * @return The term.
     */
    public static VariantTerm when(String attribute, Object match, ContextDefinition value) {
        return new VariantTerm(Collections.singletonList(new QualifierTerm(attribute, match)), value);
    }

    @Override
    public String toString() {
        return qualifiers + " => " + value;
    }
}
