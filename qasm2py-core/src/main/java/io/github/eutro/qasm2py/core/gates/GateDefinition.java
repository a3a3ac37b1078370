package io.github.eutro.qasm2py.core.gates;

import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.ControlInfo;
import io.github.eutro.qasm2py.core.ir.Instruction;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.ir.Qubit;
import io.github.eutro.qasm2py.core.util.Lazy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A gate declared in OpenQASM source, or built into a dialect.
 * <p>
 * Calling a gate with concrete parameters produces an {@link Instruction} whose
 * definition is this gate's body with the parameters bound. The body is only
 * expanded when the definition is asked for.
 * <p>
 * Gate definitions are immutable, and bodies refer to the definitions they call
 * directly, so definitions parsed from the standard include files can be shared
 * between loads.
 */
public final class GateDefinition {
    /**
     * The OpenQASM built-in single-qubit gate {@code U(θ, φ, λ)}.
     */
    public static final GateDefinition U = new GateDefinition(
            "U", "u",
            Collections.nCopies(3, "_"),
            Collections.singletonList("q"),
            null, null, true);
    /**
     * The OpenQASM 2 built-in controlled-not {@code CX}.
     */
    public static final GateDefinition CX = new GateDefinition(
            "CX", "cx",
            Collections.emptyList(),
            Arrays.asList("c", "t"),
            null, StandardGates.controlInfo("cx"), true);
    /**
     * The OpenQASM 3 built-in global phase {@code gphase(γ)}, which acts on no qubits.
     */
    public static final GateDefinition GPHASE = new GateDefinition(
            "gphase", "global_phase",
            Collections.singletonList("γ"),
            Collections.emptyList(),
            null, null, true);

    @NotNull
    private final String sourceName;
    @NotNull
    private final String name;
    @NotNull
    private final List<String> paramNames;
    @NotNull
    private final List<String> qubitNames;
    @Nullable
    private final List<Statement> body;
    @Nullable
    private final ControlInfo controlInfo;
    private final boolean standard;

    private GateDefinition(@NotNull String sourceName,
                           @NotNull String name,
                           @NotNull List<String> paramNames,
                           @NotNull List<String> qubitNames,
                           @Nullable List<Statement> body,
                           @Nullable ControlInfo controlInfo,
                           boolean standard) {
        this.sourceName = sourceName;
        this.name = name;
        this.paramNames = Collections.unmodifiableList(new ArrayList<>(paramNames));
        this.qubitNames = Collections.unmodifiableList(new ArrayList<>(qubitNames));
        this.body = body == null ? null : Collections.unmodifiableList(new ArrayList<>(body));
        this.controlInfo = controlInfo;
        this.standard = standard;
    }

    /**
     * Create a user-defined gate with a body.
     *
     * @param name       The gate name.
     * @param paramNames The names of its parameters.
     * @param qubitNames The names of its qubit arguments.
     * @param body       The statements of its body.
     * @return The gate.
     */
    public static GateDefinition define(@NotNull String name,
                                        @NotNull List<String> paramNames,
                                        @NotNull List<String> qubitNames,
                                        @NotNull List<Statement> body) {
        return new GateDefinition(name, name, paramNames, qubitNames, body, null, false);
    }

    /**
     * Create an opaque gate, which has no body.
     *
     * @param name       The gate name.
     * @param paramNames The names of its parameters.
     * @param qubitNames The names of its qubit arguments.
     * @return The gate.
     */
    public static GateDefinition opaque(@NotNull String name,
                                        @NotNull List<String> paramNames,
                                        @NotNull List<String> qubitNames) {
        return new GateDefinition(name, name, paramNames, qubitNames, null, null, false);
    }

    /**
     * Get this gate as a member of a standard library, under its
     * {@link StandardGates#canonicalName(String) canonical name}
     * and with its {@link StandardGates#controlInfo(String) control information}.
     *
     * @return The library gate.
     */
    public GateDefinition asLibraryGate() {
        String canonical = StandardGates.canonicalName(sourceName);
        return new GateDefinition(sourceName, canonical, paramNames, qubitNames, body,
                StandardGates.controlInfo(canonical), true);
    }

    /**
     * Get the name this gate has in source.
     *
     * @return The source name.
     */
    @NotNull
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Get the name of instructions calling this gate.
     *
     * @return The instruction name.
     */
    @NotNull
    public String getName() {
        return name;
    }

    public int getNumParams() {
        return paramNames.size();
    }

    public int getNumQubits() {
        return qubitNames.size();
    }

    /**
     * Get whether this is a built-in gate or a gate of a bundled standard library, whose
     * meaning is known and which can therefore be inverted or raised to a power.
     *
     * @return Whether the gate is standard.
     */
    public boolean isStandard() {
        return standard;
    }

    public boolean isOpaque() {
        return body == null;
    }

    @Nullable
    public ControlInfo getControlInfo() {
        return controlInfo;
    }

    /**
     * Create an instruction applying this gate.
     *
     * @param params The parameter values.
     * @param qubits The qubits to apply the gate to.
     * @return The instruction.
     * @throws IllegalArgumentException If the number of parameters or qubits is wrong.
     */
    public Instruction call(@NotNull List<Param> params, @NotNull List<Qubit> qubits) {
        if (params.size() != paramNames.size() || qubits.size() != qubitNames.size()) {
            throw new IllegalArgumentException(String.format(
                    "%s takes %d parameters and %d qubits, got %d and %d",
                    sourceName, paramNames.size(), qubitNames.size(), params.size(), qubits.size()));
        }
        List<Param> bound = new ArrayList<>(params);
        return new Instruction(
                name,
                bound,
                qubits,
                Collections.emptyList(),
                isOpaque() ? null : Lazy.lazy(() -> instantiate(bound)),
                controlInfo
        );
    }

    /**
     * Expand the body of this gate with the given parameters into a fresh circuit, with one
     * qubit per gate argument and no classical bits.
     *
     * @param params The parameter values.
     * @return The circuit.
     * @throws IllegalStateException If the gate is opaque.
     */
    public Circuit instantiate(@NotNull List<Param> params) {
        if (body == null) {
            throw new IllegalStateException("opaque gate " + sourceName + " has no body");
        }
        Circuit circuit = new Circuit(name);
        List<Qubit> args = new ArrayList<>(qubitNames.size());
        for (String qubitName : qubitNames) {
            Qubit qubit = new Qubit(qubitName);
            circuit.addQubit(qubit);
            args.add(qubit);
        }
        List<Param> values = Collections.unmodifiableList(new ArrayList<>(params));
        for (Statement statement : body) {
            statement.appendTo(circuit, values, args);
        }
        return circuit;
    }

    @Override
    public String toString() {
        return "gate " + sourceName + (paramNames.isEmpty() ? "" : "(" + String.join(", ", paramNames) + ")")
                + " " + String.join(", ", qubitNames);
    }

    /**
     * A statement in the body of a gate.
     */
    public interface Statement {
        /**
         * Append the instructions of this statement to the expansion of a gate.
         *
         * @param circuit The expansion being built.
         * @param params  The values of the gate's parameters.
         * @param qubits  The gate's qubit arguments, as qubits of {@code circuit}.
         */
        void appendTo(Circuit circuit, List<Param> params, List<Qubit> qubits);

        /**
         * A call to another gate, possibly with modifiers.
         *
         * @param gate      The called gate, with its modifiers applied.
         * @param params    The parameter expressions.
         * @param qubitArgs The positions, among the enclosing gate's arguments, of the qubits passed.
         * @return The statement.
         */
        static Statement call(ModifiedGate gate, List<Expr> params, int[] qubitArgs) {
            List<Expr> exprs = new ArrayList<>(params);
            int[] args = qubitArgs.clone();
            return (circuit, values, qubits) -> {
                List<Param> evaluated = new ArrayList<>(exprs.size());
                for (Expr expr : exprs) {
                    evaluated.add(expr.evaluate(values));
                }
                for (Instruction insn : gate.call(evaluated, pick(qubits, args))) {
                    circuit.append(insn);
                }
            };
        }

        /**
         * A barrier over some of the gate's arguments.
         *
         * @param qubitArgs The positions of the qubits, among the enclosing gate's arguments.
         * @return The statement.
         */
        static Statement barrier(int[] qubitArgs) {
            int[] args = qubitArgs.clone();
            return (circuit, values, qubits) -> circuit.append(new Instruction(
                    "barrier",
                    Collections.emptyList(),
                    pick(qubits, args),
                    Collections.emptyList()));
        }

        private static List<Qubit> pick(List<Qubit> qubits, int[] args) {
            List<Qubit> picked = new ArrayList<>(args.length);
            for (int arg : args) {
                picked.add(qubits.get(arg));
            }
            return picked;
        }
    }
}
