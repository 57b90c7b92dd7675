package io.github.eutro.fungraph.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something compilation events can be listened to on: a {@link io.github.eutro.fungraph.api.GraphCompiler},
 * a single {@link io.github.eutro.fungraph.api.GraphCompilation}, or every compilation of a compiler
 * through {@link io.github.eutro.fungraph.api.GraphCompiler#lift()}.
 *
 * @param <S> The common type of the events.
 */
public interface EventDispatcher<S> {
    /**
     * Run {@code listener} whenever an event of exactly {@code eventClass} is fired.
     *
     * @param eventClass The event class; subclasses and superclasses do not match.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
