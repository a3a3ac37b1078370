package io.github.eutro.qasm2py.core.gates;

import io.github.eutro.qasm2py.core.ir.ControlInfo;
import io.github.eutro.qasm2py.core.ir.Instruction;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.ir.Qubit;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A gate with {@link Modifiers} applied, as produced by {@link Modifiers#applyTo}.
 * <p>
 * Calling it yields the instructions of the underlying gate, raised to the power by
 * scaling rotation angles or by repetition, each wrapped in the controls. Its qubit
 * arguments are the controls followed by the gate's own.
 */
public final class ModifiedGate {
    @NotNull
    private final GateDefinition gate;
    @NotNull
    private final Modifiers modifiers;
    @NotNull
    private final GateDefinition base;
    private final double scale;
    private final int repeat;
    private final boolean inverted;

    ModifiedGate(@NotNull GateDefinition gate,
                 @NotNull Modifiers modifiers,
                 @NotNull GateDefinition base,
                 double scale,
                 int repeat,
                 boolean inverted) {
        this.gate = gate;
        this.modifiers = modifiers;
        this.base = base;
        this.scale = scale;
        this.repeat = repeat;
        this.inverted = inverted;
    }

    /**
     * Get a gate with no modifiers.
     *
     * @param gate The gate.
     * @return The gate, unmodified.
     */
    @NotNull
    public static ModifiedGate of(@NotNull GateDefinition gate) {
        return new ModifiedGate(gate, Modifiers.NONE, gate, 1, 1, false);
    }

    @NotNull
    public String getSourceName() {
        return gate.getSourceName();
    }

    @NotNull
    public GateDefinition getGate() {
        return gate;
    }

    @NotNull
    public Modifiers getModifiers() {
        return modifiers;
    }

    public int getNumParams() {
        return gate.getNumParams();
    }

    public int getNumQubits() {
        return modifiers.getNumControls() + gate.getNumQubits();
    }

    /**
     * Create the instructions applying this gate.
     *
     * @param params The parameter values of the unmodified gate.
     * @param qubits The control qubits, then the gate's qubits.
     * @return The instructions, empty for a zeroth power.
     * @throws IllegalArgumentException If the number of parameters or qubits is wrong.
     */
    @NotNull
    public List<Instruction> call(@NotNull List<Param> params, @NotNull List<Qubit> qubits) {
        if (params.size() != getNumParams() || qubits.size() != getNumQubits()) {
            throw new IllegalArgumentException(String.format(
                    "%s%s takes %d parameters and %d qubits, got %d and %d",
                    modifiers, gate.getSourceName(), getNumParams(), getNumQubits(), params.size(), qubits.size()));
        }
        int numControls = modifiers.getNumControls();
        List<Qubit> controls = qubits.subList(0, numControls);
        List<Qubit> targets = qubits.subList(numControls, qubits.size());

        List<Param> baseParams = params;
        if (scale != 1) {
            baseParams = new ArrayList<>(params.size());
            for (Param param : params) {
                baseParams.add(scale == -1 ? param.negate() : param.times(Param.of(scale)));
            }
        } else if (inverted) {
            baseParams = StandardGates.inverseParams(gate.getName(), params);
        }

        List<Instruction> insns = new ArrayList<>(repeat);
        for (int i = 0; i < repeat; i++) {
            Instruction insn = base.call(baseParams, targets);
            insns.add(numControls == 0 ? insn : controlled(insn, controls));
        }
        return insns;
    }

    private Instruction controlled(Instruction insn, List<Qubit> controls) {
        int outer = controls.size();
        BigInteger state = BigInteger.ZERO;
        for (int i = 0; i < outer; i++) {
            if (modifiers.isPositive(i)) state = state.setBit(i);
        }
        ControlInfo inner = insn.getControlInfo();
        ControlInfo info;
        List<Qubit> args = new ArrayList<>(controls);
        args.addAll(insn.getQubits());
        if (inner == null) {
            info = new ControlInfo(outer, insn.getName(), state);
        } else {
            info = new ControlInfo(outer + inner.getNumControlQubits(), inner.getBaseGateName(),
                    state.or(inner.getCtrlState().shiftLeft(outer)));
        }
        return new Instruction(
                StandardGates.controlledName(info),
                insn.getParams(),
                args,
                Collections.emptyList(),
                null,
                info);
    }

    @Override
    public String toString() {
        return modifiers + gate.getSourceName();
    }
}
