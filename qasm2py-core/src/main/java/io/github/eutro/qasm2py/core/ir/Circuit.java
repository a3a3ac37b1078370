package io.github.eutro.qasm2py.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A quantum circuit: an ordered qubit register, an ordered classical bit register,
 * and an ordered list of {@link Instruction instructions} over them.
 * <p>
 * Circuits are built up by the loaders, and only read afterwards.
 * The index of a bit within its register can be looked up in constant time.
 */
public final class Circuit {
    @Nullable
    private final String name;
    private final List<Qubit> qubits = new ArrayList<>();
    private final List<Clbit> clbits = new ArrayList<>();
    private final Map<Qubit, Integer> qubitIndices = new IdentityHashMap<>();
    private final Map<Clbit, Integer> clbitIndices = new IdentityHashMap<>();
    private final List<Instruction> instructions = new ArrayList<>();
    private final Set<String> parameters = new LinkedHashSet<>();

    /**
     * Create an empty circuit.
     *
     * @param name The name of the circuit, which is the gate name for gate definitions,
     *             or null for a top-level program.
     */
    public Circuit(@Nullable String name) {
        this.name = name;
    }

    @Nullable
    public String getName() {
        return name;
    }

    /**
     * Add a qubit to the end of the qubit register.
     *
     * @param qubit The qubit.
     * @return The index of the qubit.
     * @throws IllegalArgumentException If the qubit is already in this circuit.
     */
    public int addQubit(@NotNull Qubit qubit) {
        int idx = qubits.size();
        if (qubitIndices.putIfAbsent(qubit, idx) != null) {
            throw new IllegalArgumentException("duplicate qubit " + qubit);
        }
        qubits.add(qubit);
        return idx;
    }

    /**
     * Add a classical bit to the end of the classical register.
     *
     * @param clbit The bit.
     * @return The index of the bit.
     * @throws IllegalArgumentException If the bit is already in this circuit.
     */
    public int addClbit(@NotNull Clbit clbit) {
        int idx = clbits.size();
        if (clbitIndices.putIfAbsent(clbit, idx) != null) {
            throw new IllegalArgumentException("duplicate clbit " + clbit);
        }
        clbits.add(clbit);
        return idx;
    }

    /**
     * Declare a named input of this circuit, which {@link Param#symbol(String) symbolic parameters}
     * may refer to.
     *
     * @param name The name of the input.
     * @throws IllegalArgumentException If the input is already declared.
     */
    public void addParameter(@NotNull String name) {
        if (!parameters.add(name)) {
            throw new IllegalArgumentException("duplicate parameter " + name);
        }
    }

    /**
     * Get the declared inputs of this circuit, in declaration order.
     *
     * @return The names of the inputs.
     */
    @NotNull
    public Set<String> getParameters() {
        return Collections.unmodifiableSet(parameters);
    }

    /**
     * Append an instruction. All of its arguments must belong to this circuit.
     *
     * @param insn The instruction.
     */
    public void append(@NotNull Instruction insn) {
        for (Qubit q : insn.getQubits()) indexOf(q);
        for (Clbit c : insn.getClbits()) indexOf(c);
        instructions.add(insn);
    }

    @NotNull
    public List<Qubit> getQubits() {
        return Collections.unmodifiableList(qubits);
    }

    @NotNull
    public List<Clbit> getClbits() {
        return Collections.unmodifiableList(clbits);
    }

    @NotNull
    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public int getNumQubits() {
        return qubits.size();
    }

    public int getNumClbits() {
        return clbits.size();
    }

    /**
     * Get the index of a qubit in this circuit.
     *
     * @param qubit The qubit.
     * @return The index.
     * @throws IllegalArgumentException If the qubit is not in this circuit.
     */
    public int indexOf(@NotNull Qubit qubit) {
        Integer idx = qubitIndices.get(qubit);
        if (idx == null) throw new IllegalArgumentException("qubit " + qubit + " is not in circuit " + this);
        return idx;
    }

    /**
     * Get the index of a classical bit in this circuit.
     *
     * @param clbit The bit.
     * @return The index.
     * @throws IllegalArgumentException If the bit is not in this circuit.
     */
    public int indexOf(@NotNull Clbit clbit) {
        Integer idx = clbitIndices.get(clbit);
        if (idx == null) throw new IllegalArgumentException("clbit " + clbit + " is not in circuit " + this);
        return idx;
    }

    /**
     * Resolve the qubit arguments of an instruction to indices in this circuit.
     *
     * @param insn The instruction.
     * @return The indices, in argument order.
     */
    public int[] qubitIndices(@NotNull Instruction insn) {
        List<Qubit> args = insn.getQubits();
        int[] idxs = new int[args.size()];
        for (int i = 0; i < idxs.length; i++) {
            idxs[i] = indexOf(args.get(i));
        }
        return idxs;
    }

    /**
     * Resolve the classical bit arguments of an instruction to indices in this circuit.
     *
     * @param insn The instruction.
     * @return The indices, in argument order.
     */
    public int[] clbitIndices(@NotNull Instruction insn) {
        List<Clbit> args = insn.getClbits();
        int[] idxs = new int[args.size()];
        for (int i = 0; i < idxs.length; i++) {
            idxs[i] = indexOf(args.get(i));
        }
        return idxs;
    }

    @Override
    public String toString() {
        return (name == null ? "<main>" : name) + "(" + qubits.size() + " qubits, " + clbits.size() + " clbits)";
    }
}
