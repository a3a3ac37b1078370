package io.github.eutro.qasm2py.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * A classical bit handle.
 * <p>
 * Classical bits are compared by identity. The label is only for display.
 */
public final class Clbit {
    @NotNull
    private final String label;

    /**
     * Create a classical bit with the given display label.
     *
     * @param label The label, e.g. {@code c[0]}.
     */
    public Clbit(@NotNull String label) {
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
