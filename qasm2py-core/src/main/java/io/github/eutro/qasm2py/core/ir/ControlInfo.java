package io.github.eutro.qasm2py.core.ir;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Marks an instruction as a controlled gate: {@link #getNumControlQubits()} controls
 * applied to the gate named {@link #getBaseGateName()}.
 * <p>
 * The controls are always the leading qubit arguments of the instruction. Bit {@code i}
 * of the {@link #getCtrlState() control state} is the state control {@code i} must be in
 * for the base gate to apply; all ones unless some controls are negated.
 */
public final class ControlInfo {
    private final int numControlQubits;
    @NotNull
    private final String baseGateName;
    @NotNull
    private final BigInteger ctrlState;

    public ControlInfo(int numControlQubits, @NotNull String baseGateName) {
        this(numControlQubits, baseGateName, allOnes(numControlQubits));
    }

    public ControlInfo(int numControlQubits, @NotNull String baseGateName, @NotNull BigInteger ctrlState) {
        if (numControlQubits < 1) {
            throw new IllegalArgumentException("a controlled gate needs at least one control, got " + numControlQubits);
        }
        if (ctrlState.signum() < 0 || ctrlState.bitLength() > numControlQubits) {
            throw new IllegalArgumentException("control state " + ctrlState + " does not fit "
                    + numControlQubits + " controls");
        }
        this.numControlQubits = numControlQubits;
        this.baseGateName = baseGateName;
        this.ctrlState = ctrlState;
    }

    private static BigInteger allOnes(int bits) {
        return BigInteger.ONE.shiftLeft(Math.max(bits, 0)).subtract(BigInteger.ONE);
    }

    public int getNumControlQubits() {
        return numControlQubits;
    }

    @NotNull
    public String getBaseGateName() {
        return baseGateName;
    }

    @NotNull
    public BigInteger getCtrlState() {
        return ctrlState;
    }

    /**
     * Get whether some control is negated, i.e. the base gate applies when it is {@code |0>}.
     *
     * @return Whether the control state is not all ones.
     */
    public boolean hasOpenControls() {
        return !ctrlState.equals(allOnes(numControlQubits));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControlInfo that = (ControlInfo) o;
        return numControlQubits == that.numControlQubits
                && baseGateName.equals(that.baseGateName)
                && ctrlState.equals(that.ctrlState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numControlQubits, baseGateName, ctrlState);
    }

    @Override
    public String toString() {
        return "ctrl(" + numControlQubits + ") @ " + baseGateName
                + (hasOpenControls() ? " [ctrl_state=" + ctrlState + "]" : "");
    }
}
