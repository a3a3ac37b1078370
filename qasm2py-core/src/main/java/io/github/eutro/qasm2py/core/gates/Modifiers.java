package io.github.eutro.qasm2py.core.gates;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * The OpenQASM 3 gate modifiers in front of a gate call: {@code ctrl}, {@code negctrl},
 * {@code inv} and {@code pow}.
 * <p>
 * Controls are kept in source order, which is also the order of the control qubits. Since
 * raising a controlled gate to a power is the same as controlling the raised gate, the
 * {@code inv} and {@code pow} modifiers fold into a single exponent wherever they appear.
 */
public final class Modifiers {
    /**
     * No modifiers at all.
     */
    public static final Modifiers NONE = new Modifiers(Collections.emptyList(), 1);
    // integer powers are written out as repeated calls
    private static final int MAX_REPEAT = 1 << 12;

    private final List<Boolean> controls;
    private final double exponent;

    private Modifiers(List<Boolean> controls, double exponent) {
        this.controls = controls;
        this.exponent = exponent;
    }

    /**
     * Add controls after the existing ones.
     *
     * @param count    The number of control qubits.
     * @param positive True for {@code ctrl}, false for {@code negctrl}.
     * @return The new modifiers.
     */
    @NotNull
    public Modifiers control(int count, boolean positive) {
        if (count < 1) {
            throw new IllegalArgumentException("control count must be positive, got " + count);
        }
        List<Boolean> added = new ArrayList<>(controls);
        for (int i = 0; i < count; i++) added.add(positive);
        return new Modifiers(Collections.unmodifiableList(added), exponent);
    }

    @NotNull
    public Modifiers inverse() {
        return power(-1);
    }

    @NotNull
    public Modifiers power(double k) {
        if (!Double.isFinite(k)) {
            throw new IllegalArgumentException("power must be finite, got " + k);
        }
        return new Modifiers(controls, exponent * k);
    }

    public int getNumControls() {
        return controls.size();
    }

    public double getExponent() {
        return exponent;
    }

    /**
     * Get whether control {@code i} is positive, i.e. added by {@code ctrl} rather than {@code negctrl}.
     *
     * @param i The index of the control.
     * @return Whether it is positive.
     */
    public boolean isPositive(int i) {
        return controls.get(i);
    }

    /**
     * Apply these modifiers to a gate.
     * <p>
     * Inverses and powers are only known for {@link GateDefinition#isStandard() standard}
     * gates: rotations take any power, and other gates with a known inverse take integer
     * powers. Gates whose inverse is another gate ({@code s} and {@code sdg}, for instance)
     * are looked up by name when they have to be inverted.
     *
     * @param gate   The gate.
     * @param lookup Finds the gates in scope by source name, returning null for unknown ones.
     * @return The modified gate.
     * @throws IllegalArgumentException If the modifiers cannot be applied to the gate.
     */
    @NotNull
    public ModifiedGate applyTo(@NotNull GateDefinition gate,
                                @NotNull Function<String, GateDefinition> lookup) {
        if (exponent == 1) {
            return new ModifiedGate(gate, this, gate, 1, 1, false);
        }
        String name = gate.getName();
        if (!gate.isStandard() || StandardGates.inverseName(name) == null) {
            throw new IllegalArgumentException("cannot raise " + gate.getSourceName() + " to a power");
        }
        if (StandardGates.isRotation(name)) {
            return new ModifiedGate(gate, this, gate, exponent, 1, false);
        }
        if (exponent != Math.rint(exponent)) {
            throw new IllegalArgumentException("cannot raise " + gate.getSourceName()
                    + " to the non-integer power " + exponent);
        }
        if (Math.abs(exponent) > MAX_REPEAT) {
            throw new IllegalArgumentException("power " + exponent + " is too large");
        }
        int repeat = (int) exponent;
        GateDefinition base = gate;
        if (repeat < 0) {
            String inverse = StandardGates.inverseName(name);
            if (!name.equals(inverse)) {
                base = lookup.apply(inverse);
                if (base == null) {
                    throw new IllegalArgumentException("cannot invert " + gate.getSourceName()
                            + " without " + inverse + " in scope");
                }
            }
        }
        return new ModifiedGate(gate, this, base, 1, Math.abs(repeat), repeat < 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (boolean positive : controls) {
            sb.append(positive ? "ctrl @ " : "negctrl @ ");
        }
        if (exponent != 1) sb.append("pow(").append(exponent).append(") @ ");
        return sb.toString();
    }
}
