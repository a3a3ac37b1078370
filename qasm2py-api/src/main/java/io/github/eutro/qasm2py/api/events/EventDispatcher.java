package io.github.eutro.qasm2py.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Something translation listeners can be registered on.
 *
 * @param <S> The supertype of the events it fires.
 */
public interface EventDispatcher<S> {
    /**
     * Register a listener for events of the given class.
     * <p>
     * Events are matched on their exact class: a listener for {@code eventClass}
     * never sees instances of its subclasses.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);

    /**
     * Register a listener that only runs for events accepted by {@code filter}.
     *
     * @param eventClass The event class.
     * @param filter     Which events the listener should see.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    default <T extends S> void listen(Class<T> eventClass,
                                      @NotNull Predicate<? super T> filter,
                                      @NotNull Consumer<T> listener) {
        listen(eventClass, evt -> {
            if (filter.test(evt)) listener.accept(evt);
        });
    }
}
