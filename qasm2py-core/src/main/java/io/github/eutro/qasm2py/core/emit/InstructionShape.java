package io.github.eutro.qasm2py.core.emit;

import io.github.eutro.qasm2py.core.gates.StandardGates;
import io.github.eutro.qasm2py.core.ir.ControlInfo;
import io.github.eutro.qasm2py.core.ir.Instruction;
import io.github.eutro.qasm2py.core.ir.Param;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.github.eutro.qasm2py.core.emit.PythonLiterals.list;
import static io.github.eutro.qasm2py.core.emit.PythonLiterals.repr;

/**
 * The kinds of instruction the {@link InstructionEmitter} knows how to write, in the order
 * they are tried. The first shape that {@link #matches(Instruction, int[], int[]) matches}
 * an instruction decides its statement; {@link #UNSUPPORTED} matches everything.
 * <p>
 * A shape only matches an instruction that has all the arguments it reads, so no shape
 * throws while emitting.
 */
public enum InstructionShape {
    /**
     * A controlled gate. Single controlled-x and double controlled-x use {@code cx} and
     * {@code ccx}; every other controlled gate is written as a multi-controlled x over
     * its controls, whatever its base gate. Negated controls pass a {@code ctrl_state}.
     */
    CONTROLLED {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return insn.getControlInfo() != null && qubits.length >= 1;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            ControlInfo info = insn.getControlInfo();
            assert info != null;
            int[] controls = Arrays.copyOf(qubits, qubits.length - 1);
            int target = qubits[qubits.length - 1];
            String state = info.hasOpenControls() ? ", ctrl_state=" + info.getCtrlState() : "";
            if ("x".equals(info.getBaseGateName())) {
                if (info.getNumControlQubits() == 1 && controls.length >= 1) {
                    return var + ".cx(" + controls[0] + ", " + target + state + ")";
                }
                if (info.getNumControlQubits() == 2 && controls.length >= 2) {
                    return var + ".ccx(" + controls[0] + ", " + controls[1] + ", " + target + state + ")";
                }
            }
            return var + ".mcx(" + list(controls) + ", " + target + state + ")";
        }
    },
    MEASURE {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return "measure".equals(insn.getName()) && qubits.length >= 1 && clbits.length >= 1;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return call(var, "measure", qubits[0], clbits[0]);
        }
    },
    BARRIER {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return "barrier".equals(insn.getName());
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return var + ".barrier(" + list(qubits) + ")";
        }
    },
    RESET {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return "reset".equals(insn.getName()) && qubits.length >= 1;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return call(var, "reset", qubits[0]);
        }
    },
    SINGLE_QUBIT {
        private final Set<String> names = setOf("id", "i", "x", "y", "z", "h", "s", "sdg", "t", "tdg", "sx", "sxdg");

        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return names.contains(insn.getName()) && qubits.length >= 1;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            String name = "i".equals(insn.getName()) ? "id" : insn.getName();
            return call(var, name, qubits[0]);
        }
    },
    SINGLE_QUBIT_PARAMETRIC {
        private final Set<String> rotations = setOf("rx", "ry", "rz", "p");

        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            if (qubits.length < 1) return false;
            int params = insn.getParams().size();
            return rotations.contains(insn.getName()) && params >= 1
                    || "u".equals(insn.getName()) && params >= 3;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            List<Param> p = insn.getParams();
            if ("u".equals(insn.getName())) {
                return var + ".u(" + repr(p.get(0)) + ", " + repr(p.get(1)) + ", " + repr(p.get(2))
                        + ", " + qubits[0] + ")";
            }
            return var + "." + insn.getName() + "(" + repr(p.get(0)) + ", " + qubits[0] + ")";
        }
    },
    TWO_QUBIT {
        private final Set<String> names = setOf("cx", "cy", "cz", "swap");

        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return names.contains(insn.getName()) && qubits.length >= 2;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return call(var, insn.getName(), qubits[0], qubits[1]);
        }
    },
    TWO_QUBIT_PARAMETRIC {
        private final Set<String> names = setOf("cp", "crx", "cry", "crz");

        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return names.contains(insn.getName()) && qubits.length >= 2 && insn.getParams().size() >= 1;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return var + "." + insn.getName() + "(" + repr(insn.getParams().get(0)) + ", "
                    + qubits[0] + ", " + qubits[1] + ")";
        }
    },
    TOFFOLI {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return "ccx".equals(insn.getName()) && qubits.length >= 3;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return call(var, "ccx", qubits[0], qubits[1], qubits[2]);
        }
    },
    MULTI_CONTROLLED_X {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return "mcx".equals(insn.getName()) && qubits.length >= 1;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return var + ".mcx(" + list(Arrays.copyOf(qubits, qubits.length - 1)) + ", "
                    + qubits[qubits.length - 1] + ")";
        }
    },
    CUSTOM_GATE {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return insn.hasDefinition() && !StandardGates.isPrimitive(insn.getName());
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return var + ".append(" + builderName(insn.getName()) + "(), " + list(qubits) + ")";
        }
    },
    UNSUPPORTED {
        @Override
        boolean matches(Instruction insn, int[] qubits, int[] clbits) {
            return true;
        }

        @Override
        String emit(String var, Instruction insn, int[] qubits, int[] clbits) {
            return "# Unsupported gate: " + insn.getName()
                    + " params=" + list(insn.getParams())
                    + " qubits=" + list(qubits);
        }
    },
    ;

    /**
     * Get whether an instruction has this shape.
     *
     * @param insn   The instruction.
     * @param qubits The indices of its qubits.
     * @param clbits The indices of its classical bits.
     * @return Whether this shape applies.
     */
    abstract boolean matches(Instruction insn, int[] qubits, int[] clbits);

    /**
     * Write the statement for an instruction of this shape.
     *
     * @param var    The circuit variable.
     * @param insn   The instruction.
     * @param qubits The indices of its qubits.
     * @param clbits The indices of its classical bits.
     * @return The statement, without indentation.
     */
    abstract String emit(String var, Instruction insn, int[] qubits, int[] clbits);

    /**
     * Find the first shape that matches an instruction.
     *
     * @param insn   The instruction.
     * @param qubits The indices of its qubits.
     * @param clbits The indices of its classical bits.
     * @return The shape, {@link #UNSUPPORTED} if no other matches.
     */
    @NotNull
    public static InstructionShape of(@NotNull Instruction insn, int @NotNull [] qubits, int @NotNull [] clbits) {
        for (InstructionShape shape : values()) {
            if (shape.matches(insn, qubits, clbits)) return shape;
        }
        throw new AssertionError("unreachable, UNSUPPORTED matches everything");
    }

    /**
     * Get the name of the Python function that builds a custom gate.
     *
     * @param gateName The gate name.
     * @return The function name.
     */
    @NotNull
    public static String builderName(@NotNull String gateName) {
        return "build_" + gateName;
    }

    private static String call(String var, String method, int... args) {
        StringBuilder sb = new StringBuilder(var).append('.').append(method).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i != 0) sb.append(", ");
            sb.append(args[i]);
        }
        return sb.append(')').toString();
    }

    private static Set<String> setOf(String... names) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
    }
}
