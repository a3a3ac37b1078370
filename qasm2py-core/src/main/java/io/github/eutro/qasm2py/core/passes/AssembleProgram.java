package io.github.eutro.qasm2py.core.passes;

import io.github.eutro.qasm2py.core.conf.TranslationOptions;
import io.github.eutro.qasm2py.core.emit.CustomGateTable;
import io.github.eutro.qasm2py.core.emit.EmittedProgram;
import io.github.eutro.qasm2py.core.emit.InstructionEmitter;
import io.github.eutro.qasm2py.core.emit.InstructionShape;
import io.github.eutro.qasm2py.core.emit.PythonLiterals;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Instruction;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the Python program that rebuilds a circuit.
 * <p>
 * The program consists of, in order: the import lines (if enabled), one {@code Parameter}
 * per circuit input, one builder function per custom gate, the declaration of the main
 * circuit, and one statement per instruction of the main circuit. Programs without
 * inputs declare no parameters and import only {@code QuantumCircuit}.
 */
public final class AssembleProgram implements IRPass<Circuit, EmittedProgram> {
    static final String IMPORT_LINE = "from qiskit import QuantumCircuit";
    static final String PARAMETER_IMPORT_LINE = "from qiskit.circuit import Parameter";
    private static final String GATE_VAR = "g";
    private static final String INDENT = "    ";

    private final TranslationOptions options;

    public AssembleProgram(@NotNull TranslationOptions options) {
        this.options = options;
    }

    @NotNull
    public TranslationOptions getOptions() {
        return options;
    }

    /**
     * Assemble the program for a circuit whose custom gates have already been collected.
     *
     * @param circuit     The main circuit.
     * @param customGates The custom gates, in the order their builders should be written.
     * @return The program.
     */
    @NotNull
    public EmittedProgram assemble(@NotNull Circuit circuit, @NotNull CustomGateTable customGates) {
        List<String> lines = new ArrayList<>();
        Set<String> parameters = circuit.getParameters();
        if (options.isIncludeImports()) {
            lines.add(IMPORT_LINE);
            if (!parameters.isEmpty()) lines.add(PARAMETER_IMPORT_LINE);
            lines.add("");
        }
        if (!parameters.isEmpty()) {
            for (String parameter : parameters) {
                lines.add(parameter + " = Parameter(" + PythonLiterals.repr(parameter) + ")");
            }
            lines.add("");
        }

        for (Map.Entry<String, Circuit> entry : customGates) {
            String name = entry.getKey();
            Circuit definition = entry.getValue();
            lines.add("def " + InstructionShape.builderName(name) + "():");
            lines.add(INDENT + GATE_VAR + " = QuantumCircuit(" + definition.getNumQubits()
                    + ", name=" + PythonLiterals.repr(name) + ")");
            for (Instruction insn : definition.getInstructions()) {
                lines.addAll(InstructionEmitter.emit(definition, insn, GATE_VAR, INDENT));
            }
            lines.add(INDENT + "return " + GATE_VAR + ".to_gate()");
            lines.add("");
        }

        String var = options.getVariableName();
        lines.add(var + " = QuantumCircuit(" + circuit.getNumQubits() + ", " + circuit.getNumClbits() + ")");
        lines.add("");
        for (Instruction insn : circuit.getInstructions()) {
            lines.addAll(InstructionEmitter.emit(circuit, insn, var, ""));
        }
        return new EmittedProgram(lines);
    }

    @Override
    public EmittedProgram run(Circuit circuit) {
        return assemble(circuit, CollectCustomGates.INSTANCE.run(circuit));
    }
}
