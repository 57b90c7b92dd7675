package io.github.eutro.fungraph.core.types;

/**
 * The projector value {@code _}, marking the projected path of a query.
 */
public final class Projector {
    public static final Projector INSTANCE = new Projector();

    private Projector() {
    }

    @Override
    public String toString() {
        return "_";
    }
}
