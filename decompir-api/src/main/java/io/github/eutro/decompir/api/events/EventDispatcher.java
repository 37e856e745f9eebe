package io.github.eutro.decompir.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that events of type {@code S} can be listened to on.
 *
 * @param <S> The supertype of the events.
 */
public interface EventDispatcher<S> {
    /**
     * Add a listener for an event type.
     * <p>
     * The listener only receives events dispatched as exactly {@code eventClass}.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
