package io.github.eutro.qasm2py.core.ir;

import io.github.eutro.qasm2py.core.util.Lazy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single operation of a {@link Circuit}: a gate application, measurement, reset or barrier.
 * <p>
 * Arguments are positional; for gates the first qubit is the first operand, and for
 * {@link #getControlInfo() controlled gates} the leading qubits are the controls.
 * <p>
 * An instruction may carry a {@link #getDefinition() definition}, its expansion into simpler
 * instructions. The definition is computed on first request.
 */
public final class Instruction {
    @NotNull
    private final String name;
    @NotNull
    private final List<Param> params;
    @NotNull
    private final List<Qubit> qubits;
    @NotNull
    private final List<Clbit> clbits;
    @Nullable
    private final Lazy<Circuit> definition;
    @Nullable
    private final ControlInfo controlInfo;

    /**
     * Construct an instruction.
     *
     * @param name        The name of the operation.
     * @param params      The parameters.
     * @param qubits      The qubit arguments.
     * @param clbits      The classical bit arguments.
     * @param definition  The expansion of this instruction, or null if it has none.
     * @param controlInfo The control information, if this is a controlled gate.
     */
    public Instruction(@NotNull String name,
                       @NotNull List<Param> params,
                       @NotNull List<Qubit> qubits,
                       @NotNull List<Clbit> clbits,
                       @Nullable Lazy<Circuit> definition,
                       @Nullable ControlInfo controlInfo) {
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.qubits = Collections.unmodifiableList(new ArrayList<>(qubits));
        this.clbits = Collections.unmodifiableList(new ArrayList<>(clbits));
        this.definition = definition;
        this.controlInfo = controlInfo;
    }

    /**
     * Construct an instruction with no definition and no control information.
     *
     * @param name   The name of the operation.
     * @param params The parameters.
     * @param qubits The qubit arguments.
     * @param clbits The classical bit arguments.
     */
    public Instruction(@NotNull String name,
                       @NotNull List<Param> params,
                       @NotNull List<Qubit> qubits,
                       @NotNull List<Clbit> clbits) {
        this(name, params, qubits, clbits, null, null);
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public List<Param> getParams() {
        return params;
    }

    @NotNull
    public List<Qubit> getQubits() {
        return qubits;
    }

    @NotNull
    public List<Clbit> getClbits() {
        return clbits;
    }

    /**
     * Get whether this instruction has a definition, without computing it.
     *
     * @return Whether {@link #getDefinition()} is non-null.
     */
    public boolean hasDefinition() {
        return definition != null;
    }

    /**
     * Get the definition of this instruction, computing it if necessary.
     * <p>
     * The definition has exactly as many qubits and classical bits as this
     * instruction has arguments.
     *
     * @return The definition, or null if there is none.
     * @throws IllegalStateException If the computed definition does not match the arity of this instruction.
     */
    @Nullable
    public Circuit getDefinition() {
        if (definition == null) return null;
        boolean fresh = !definition.isComputed();
        Circuit def = definition.get();
        if (fresh && (def.getNumQubits() != qubits.size() || def.getNumClbits() != clbits.size())) {
            throw new IllegalStateException(String.format(
                    "definition of %s has %d qubits and %d clbits, but it is applied to %d and %d",
                    name, def.getNumQubits(), def.getNumClbits(), qubits.size(), clbits.size()));
        }
        return def;
    }

    @Nullable
    public ControlInfo getControlInfo() {
        return controlInfo;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (!params.isEmpty()) {
            sb.append(params.toString().replace('[', '(').replace(']', ')'));
        }
        sb.append(' ').append(qubits);
        if (!clbits.isEmpty()) sb.append(" -> ").append(clbits);
        return sb.toString();
    }
}
