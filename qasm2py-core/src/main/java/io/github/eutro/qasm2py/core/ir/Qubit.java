package io.github.eutro.qasm2py.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * A qubit handle.
 * <p>
 * Qubits are compared by identity. The label is only for display.
 */
public final class Qubit {
    @NotNull
    private final String label;

    /**
     * Create a qubit with the given display label.
     *
     * @param label The label, e.g. {@code q[0]}, or a gate argument name.
     */
    public Qubit(@NotNull String label) {
        this.label = label;
    }

    @NotNull
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
