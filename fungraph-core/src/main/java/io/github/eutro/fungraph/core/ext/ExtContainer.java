package io.github.eutro.fungraph.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * Something graph passes and the function catalogue can hang {@link Ext}s on.
 */
public interface ExtContainer {
    /**
     * Set the value of {@code ext}, replacing any previous one.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Drop the value of {@code ext}. Passes call this to discard scratch data of an earlier run.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if it was never attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext}, attaching a fresh one first if it is absent.
     *
     * @param ext     The ext.
     * @param compute Creates the value.
     * @param <T>     The type of the ext.
     * @return The value.
     */
    default <T> T getExtOrCompute(Ext<T> ext, Supplier<T> compute) {
        T value = getNullable(ext);
        if (value == null) {
            value = compute.get();
            attachExt(ext, value);
        }
        return value;
    }
}
