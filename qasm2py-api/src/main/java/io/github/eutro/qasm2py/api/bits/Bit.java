package io.github.eutro.qasm2py.api.bits;

import java.util.function.Function;

/**
 * A reusable piece of translator setup, such as an output sink.
 *
 * @param <Onto> What it is installed on, usually a translator or one of its dispatchers.
 * @param <Ret>  What installing it hands back.
 */
@FunctionalInterface
public interface Bit<Onto, Ret> {
    /**
     * Install this on {@code target}.
     *
     * @param target Where to install it.
     * @return The result of installing it.
     */
    Ret addTo(Onto target);

    /**
     * Install this, then transform what it returned.
     *
     * @param after The transformation.
     * @param <R>   The new result type.
     * @return The combined bit.
     */
    default <R> Bit<Onto, R> andThen(Function<? super Ret, ? extends R> after) {
        return target -> after.apply(addTo(target));
    }
}
