package io.github.eutro.fungraph.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for side data attached to graph nodes and function keys,
 * stored in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so holders backed by sorted maps iterate
 * them deterministically within one JVM.
 *
 * @param <T> The type of the value associated with this ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class only serves debugging; generic value types such as {@code List<FunctionNode>}
     * are created with their raw class.
     *
     * @param type The most specific class of values of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The class type.
     * @param <R>  The (possibly generic) type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
