package io.github.eutro.qasm2py.core.passes;

import io.github.eutro.qasm2py.core.emit.CustomGateTable;
import io.github.eutro.qasm2py.core.gates.StandardGates;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Instruction;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Finds the custom gates a circuit uses: every non-primitive gate with a definition,
 * including those used only inside other custom gates.
 * <p>
 * Gates are recorded in depth-first pre-order, so a gate appears before the gates its
 * definition calls. Gates are identified by name; only the first definition seen for a
 * name is kept, and its definition is only walked once.
 */
public final class CollectCustomGates implements IRPass<Circuit, CustomGateTable> {
    public static final CollectCustomGates INSTANCE = new CollectCustomGates();

    private CollectCustomGates() {
    }

    /**
     * Collect the custom gates of some instructions.
     *
     * @param instructions The instructions.
     * @return The custom gates.
     */
    @NotNull
    public static CustomGateTable collect(@NotNull List<Instruction> instructions) {
        CustomGateTable table = new CustomGateTable();
        visit(table, instructions);
        return table;
    }

    private static void visit(CustomGateTable table, List<Instruction> instructions) {
        for (Instruction insn : instructions) {
            if (!insn.hasDefinition()
                    || StandardGates.isPrimitive(insn.getName())
                    || table.contains(insn.getName())) {
                continue;
            }
            Circuit definition = insn.getDefinition();
            assert definition != null;
            table.add(insn.getName(), definition);
            visit(table, definition.getInstructions());
        }
    }

    @Override
    public CustomGateTable run(Circuit circuit) {
        return collect(circuit.getInstructions());
    }
}
