package io.github.eutro.decompir.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * An {@link EventDispatcher} which also dispatches its events.
 * <p>
 * Listeners of an event type run in the order they were added. A listener that throws stops
 * the dispatch, and the exception propagates to the dispatcher.
 *
 * @param <S> The supertype of the events.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new HashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new ArrayList<>()).add(listener);
    }

    /**
     * Dispatch an event to the listeners of its exact type.
     *
     * @param eventClass The type the event is dispatched as.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, after all listeners have seen it.
     */
    @SuppressWarnings("unchecked")
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        List<Consumer<?>> eventListeners = listeners.get(eventClass);
        if (eventListeners == null) return event;
        for (Consumer<?> listener : new ArrayList<>(eventListeners)) {
            ((Consumer<T>) listener).accept(event);
        }
        return event;
    }
}
