package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.core.ir.Circuit;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when the source of a translation has been loaded. Listeners may replace the circuit.
 */
public class ReceiveCircuitEvent implements TranslationEvent {
    @NotNull
    public Circuit circuit;

    public ReceiveCircuitEvent(@NotNull Circuit circuit) {
        this.circuit = circuit;
    }
}
