package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.core.emit.CustomGateTable;
import io.github.eutro.qasm2py.core.ir.Circuit;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the custom gates of a circuit have been collected, before any code is emitted.
 * <p>
 * Listeners may add gates to, or replace, the table; a builder function is emitted for every
 * gate in it, in order.
 */
public class CustomGatesEvent implements TranslationEvent {
    /**
     * The circuit being translated.
     */
    @NotNull
    public final Circuit circuit;
    /**
     * The custom gates.
     */
    @NotNull
    public CustomGateTable customGates;

    public CustomGatesEvent(@NotNull Circuit circuit, @NotNull CustomGateTable customGates) {
        this.circuit = circuit;
        this.customGates = customGates;
    }
}
