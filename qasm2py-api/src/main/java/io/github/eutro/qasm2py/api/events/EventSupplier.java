package io.github.eutro.qasm2py.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * An {@link EventDispatcher} that also fires its events.
 * <p>
 * Listeners run in registration order. A listener may register further listeners
 * while an event is being fired; those only see later events.
 *
 * @param <S> The supertype of the events it fires.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private static final Logger LOG = Logger.getLogger(EventSupplier.class.getName());

    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * Check whether anything listens to the given event class.
     *
     * @param eventClass The event class.
     * @return Whether a listener is registered for it.
     */
    public boolean hasListeners(Class<? extends S> eventClass) {
        List<Consumer<?>> registered = listeners.get(eventClass);
        return registered != null && !registered.isEmpty();
    }

    /**
     * Fire an event, stopping early if it is a {@link CancellableEvent} that gets cancelled.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, as the listeners left it.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        List<Consumer<?>> registered = listeners.get(eventClass);
        if (registered == null) return event;
        for (Consumer<?> listener : registered) {
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) {
                LOG.fine(() -> eventClass.getSimpleName() + " cancelled");
                break;
            }
            @SuppressWarnings("unchecked")
            Consumer<T> typed = (Consumer<T>) listener;
            typed.accept(event);
        }
        return event;
    }
}
