package io.github.eutro.qasm2py.core.emit;

import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Instruction;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes the Python statement that applies one {@link Instruction} to a Qiskit
 * {@code QuantumCircuit} variable.
 * <p>
 * Emitting never fails: instructions of no known {@link InstructionShape shape} become
 * a comment naming the instruction.
 */
public final class InstructionEmitter {
    private static final Logger LOG = Logger.getLogger(InstructionEmitter.class.getName());

    private InstructionEmitter() {
    }

    /**
     * Emit an instruction.
     *
     * @param insn   The instruction.
     * @param var    The name of the circuit variable.
     * @param qubits The indices of the instruction's qubits in the circuit.
     * @param clbits The indices of the instruction's classical bits in the circuit.
     * @param indent The indentation to prefix each line with.
     * @return The lines.
     */
    @NotNull
    public static List<String> emit(@NotNull Instruction insn,
                                    @NotNull String var,
                                    int @NotNull [] qubits,
                                    int @NotNull [] clbits,
                                    @NotNull String indent) {
        InstructionShape shape = InstructionShape.of(insn, qubits, clbits);
        if (shape == InstructionShape.UNSUPPORTED) {
            LOG.fine(() -> "no statement for instruction " + insn + ", emitting a comment");
        }
        return Collections.singletonList(indent + shape.emit(var, insn, qubits, clbits));
    }

    /**
     * Emit an instruction of a circuit, resolving its arguments against the circuit's registers.
     *
     * @param circuit The circuit the instruction belongs to.
     * @param insn    The instruction.
     * @param var     The name of the circuit variable.
     * @param indent  The indentation to prefix each line with.
     * @return The lines.
     */
    @NotNull
    public static List<String> emit(@NotNull Circuit circuit,
                                    @NotNull Instruction insn,
                                    @NotNull String var,
                                    @NotNull String indent) {
        return emit(insn, var, circuit.qubitIndices(insn), circuit.clbitIndices(insn), indent);
    }
}
