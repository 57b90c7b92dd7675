package io.github.eutro.fungraph.core.util;

import java.util.function.Supplier;

/**
 * A lazily-initialized value.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    private Supplier<T> thunk;
    private T value;
    private boolean forcing = false;

    private Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    /**
     * Create a lazily-initialized value.
     *
     * @param thunk The function that produces the value.
     * @param <T>   The type of the value.
     * @return The lazily-initialized value.
     */
    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    /**
     * Get the value, initializing it on first use.
     *
     * @return The value.
     * @throws IllegalStateException If the thunk requests its own value.
     */
    @Override
    public T get() {
        if (thunk != null) {
            if (forcing) {
                throw new IllegalStateException("Lazy value requested while it is being computed");
            }
            forcing = true;
            try {
                value = thunk.get();
                thunk = null;
            } finally {
                forcing = false;
            }
        }
        return value;
    }

    /**
     * Whether the value has been computed.
     *
     * @return Whether {@link #get()} has completed once.
     */
    public boolean isForced() {
        return thunk == null;
    }

    /**
     * Whether the thunk is currently running.
     *
     * @return Whether {@link #get()} is on the stack.
     */
    public boolean isForcing() {
        return forcing;
    }
}
