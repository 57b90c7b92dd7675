package io.github.eutro.fungraph.api.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Consumer;

/**
 * A class on which events can be listened to and dispatched.
 * <p>
 * Listeners run in the order they were added. Graph compilation is single-threaded,
 * so listeners should only be added from the compiling thread.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private static final Logger logger = LogManager.getLogger();

    private final Map<Class<?>, Set<Consumer<?>>> listeners = new HashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(
                eventClass,
                $ -> new LinkedHashSet<>()
        ).add(listener);
    }

    /**
     * Dispatch an event to listeners.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        Set<Consumer<T>> eventListeners = (Set<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptySet());
        logger.trace("dispatching {} to {} listeners", eventClass.getSimpleName(), eventListeners.size());
        for (Consumer<T> consumer : new ArrayList<>(eventListeners)) {
            if (event instanceof CancellableEvent
                    && ((CancellableEvent) event).isCancelled()) {
                break;
            }
            consumer.accept(event);
        }
        return event;
    }
}
