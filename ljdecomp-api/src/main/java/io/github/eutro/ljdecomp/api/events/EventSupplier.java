package io.github.eutro.ljdecomp.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Something events can be listened to and dispatched on.
 * <p>
 * Events may be dispatched from several threads at once when functions are decompiled
 * concurrently, so listeners must be safe to call that way.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, Set<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArraySet<>()).add(listener);
    }

    /**
     * Dispatch an event to listeners, in the order they were added.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        Set<Consumer<?>> eventListeners = listeners.get(eventClass);
        if (eventListeners == null) return event;
        for (Consumer<?> listener : eventListeners) {
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) {
                break;
            }
            @SuppressWarnings("unchecked")
            Consumer<T> consumer = (Consumer<T>) listener;
            consumer.accept(event);
        }
        return event;
    }
}
