package io.github.eutro.qasm2py.core.util;

import java.util.function.Supplier;

/**
 * A lazily-computed value.
 * <p>
 * Gate definitions are built through these, so that the expansion of a gate call is only
 * ever constructed if something asks for it.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    /**
     * The function computing the value, or null once it has run.
     */
    private Supplier<T> thunk;
    /**
     * The value, valid once {@link #thunk} is null.
     */
    private T value;

    private Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    /**
     * Create a lazily-computed value.
     *
     * @param thunk The function that produces the value. It is called at most once.
     * @param <T>   The type of the value.
     * @return The lazy value.
     */
    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    /**
     * Create an already-computed value.
     *
     * @param value The value.
     * @param <T>   The type of the value.
     * @return The lazy value.
     */
    public static <T> Lazy<T> of(T value) {
        Lazy<T> lazy = new Lazy<>(null);
        lazy.value = value;
        return lazy;
    }

    /**
     * Get the value, computing it if this is the first call.
     *
     * @return The value.
     */
    @Override
    public T get() {
        if (thunk != null) {
            Supplier<T> thunk = this.thunk;
            this.thunk = null;
            value = thunk.get();
        }
        return value;
    }

    /**
     * Get whether the value has already been computed.
     *
     * @return Whether {@link #get()} would return without computing anything.
     */
    public boolean isComputed() {
        return thunk == null;
    }
}
