package io.github.eutro.qasm2py.core.parse;

import io.github.eutro.qasm2py.core.gates.Expr;
import io.github.eutro.qasm2py.core.gates.GateDefinition;
import io.github.eutro.qasm2py.core.gates.ModifiedGate;
import io.github.eutro.qasm2py.core.gates.Modifiers;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Clbit;
import io.github.eutro.qasm2py.core.ir.Instruction;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.ir.Qubit;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The semantics common to both dialects, driven by their tree visitors: register
 * declarations, gate definitions, gate calls with broadcasting, and the pieces of
 * parameter expressions.
 * <p>
 * A builder is single-use. It either builds a program, producing a {@link Circuit},
 * or a library (an include file), producing the gates it defines.
 */
final class CircuitBuilder {
    private static final List<Param> NO_PARAMS = Collections.emptyList();

    /**
     * Whether gates defined in this source belong to a standard library.
     */
    private final boolean library;
    private final Map<String, Double> constants;
    private final Map<String, Param.Function> functions;

    private final Map<String, GateDefinition> gates = new LinkedHashMap<>();
    private final Map<String, List<Qubit>> qregs = new LinkedHashMap<>();
    private final Map<String, List<Clbit>> cregs = new LinkedHashMap<>();
    private final Circuit circuit = new Circuit(null);

    CircuitBuilder(boolean library,
                   @NotNull Collection<GateDefinition> builtins,
                   @NotNull Map<String, Double> constants,
                   @NotNull Map<String, Param.Function> functions) {
        this.library = library;
        this.constants = constants;
        this.functions = functions;
        for (GateDefinition builtin : builtins) {
            gates.put(builtin.getSourceName(), builtin);
        }
    }

    static QasmSyntaxException error(Token at, String message) {
        return new QasmSyntaxException(at.getLine(), at.getCharPositionInLine() + 1, message);
    }

    Circuit getCircuit() {
        return circuit;
    }

    Map<String, GateDefinition> getGates() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(gates));
    }

    // declarations

    void checkVersion(Token version, int major) {
        String text = version.getText();
        String found = text.contains(".") ? text.substring(0, text.indexOf('.')) : text;
        if (!found.equals(Integer.toString(major))) {
            throw error(version, "expected OpenQASM " + major + ", found version " + text);
        }
    }

    /**
     * Check that a statement of a library did not do anything but define gates.
     *
     * @param start The first token of the statement.
     */
    void checkLibraryStatement(Token start) {
        if (!qregs.isEmpty() || !cregs.isEmpty()
                || !circuit.getInstructions().isEmpty() || !circuit.getParameters().isEmpty()) {
            throw error(start, "libraries may only define gates");
        }
    }

    void include(Token path, String available, Supplier<Map<String, GateDefinition>> included) {
        String file = unquote(path);
        if (!file.equals(available)) {
            throw error(path, "cannot include " + path.getText() + ", only \"" + available + "\" is available");
        }
        for (Map.Entry<String, GateDefinition> entry : included.get().entrySet()) {
            GateDefinition existing = gates.get(entry.getKey());
            if (existing == null) {
                gates.put(entry.getKey(), entry.getValue());
            } else if (existing != entry.getValue()) {
                throw error(path, "include of " + path.getText() + " redefines gate " + entry.getKey());
            }
        }
    }

    private static String unquote(Token string) {
        String text = string.getText();
        return text.substring(1, text.length() - 1);
    }

    int size(Token integer) {
        try {
            return Integer.parseInt(integer.getText());
        } catch (NumberFormatException e) {
            throw error(integer, "index " + integer.getText() + " is out of range");
        }
    }

    void declareQubits(Token name, int size) {
        checkFreshName(name);
        List<Qubit> reg = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Qubit qubit = new Qubit(name.getText() + "[" + i + "]");
            circuit.addQubit(qubit);
            reg.add(qubit);
        }
        qregs.put(name.getText(), Collections.unmodifiableList(reg));
    }

    void declareClbits(Token name, int size) {
        checkFreshName(name);
        List<Clbit> reg = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Clbit clbit = new Clbit(name.getText() + "[" + i + "]");
            circuit.addClbit(clbit);
            reg.add(clbit);
        }
        cregs.put(name.getText(), Collections.unmodifiableList(reg));
    }

    /**
     * Declare an input of the circuit, which expressions can then refer to by name.
     *
     * @param name The name of the input.
     */
    void declareInput(Token name) {
        checkFreshName(name);
        if (constants.containsKey(name.getText())) {
            throw error(name, "input " + name.getText() + " shadows a built-in constant");
        }
        circuit.addParameter(name.getText());
    }

    private void checkFreshName(Token name) {
        String text = name.getText();
        if (qregs.containsKey(text) || cregs.containsKey(text) || circuit.getParameters().contains(text)) {
            throw error(name, text + " is already declared");
        }
    }

    void defineGate(Token name, GateDefinition gate) {
        if (gates.containsKey(name.getText())) {
            throw error(name, "gate " + name.getText() + " is already defined");
        }
        gates.put(name.getText(), library ? gate.asLibraryGate() : gate);
    }

    /**
     * Collect a list of names declared together, such as the parameters of a gate.
     *
     * @param ids  The names, possibly none.
     * @param what What the names are, for errors.
     * @return The position of each name.
     */
    static Map<String, Integer> names(@NotNull List<TerminalNode> ids, String what) {
        Map<String, Integer> names = new LinkedHashMap<>();
        for (TerminalNode id : ids) {
            if (names.putIfAbsent(id.getText(), names.size()) != null) {
                throw error(id.getSymbol(), "duplicate " + what + " " + id.getText());
            }
        }
        return names;
    }

    // operations

    GateDefinition resolveGate(Token name) {
        GateDefinition gate = gates.get(name.getText());
        if (gate == null) {
            throw error(name, "undefined gate " + name.getText());
        }
        return gate;
    }

    ModifiedGate modify(Token name, Modifiers modifiers) {
        GateDefinition gate = resolveGate(name);
        if (modifiers == Modifiers.NONE) return ModifiedGate.of(gate);
        try {
            return modifiers.applyTo(gate, gates::get);
        } catch (IllegalArgumentException e) {
            throw error(name, e.getMessage());
        }
    }

    private static void checkArity(Token at, ModifiedGate gate, int params, int qubits) {
        if (params != gate.getNumParams()) {
            throw error(at, gate + " takes " + gate.getNumParams() + " parameters, got " + params);
        }
        if (qubits != gate.getNumQubits()) {
            throw error(at, gate + " takes " + gate.getNumQubits() + " qubits, got " + qubits);
        }
    }

    /**
     * Build a call in the body of a gate definition.
     *
     * @param name  The name of the called gate.
     * @param gate  The called gate.
     * @param exprs The parameter expressions.
     * @param args  The positions of the qubits passed, among the enclosing gate's arguments.
     * @return The statement.
     */
    static GateDefinition.Statement bodyCall(Token name, ModifiedGate gate, List<Expr> exprs, int[] args) {
        checkArity(name, gate, exprs.size(), args.length);
        Set<Integer> seen = new HashSet<>();
        for (int arg : args) {
            if (!seen.add(arg)) {
                throw error(name, "duplicate qubit arguments to " + name.getText());
            }
        }
        return GateDefinition.Statement.call(gate, exprs, args);
    }

    /**
     * Resolve a qubit argument in the body of a gate definition.
     *
     * @param id    The argument name.
     * @param index The index applied to it, which is always an error, or null.
     * @param qargs The positions of the enclosing gate's qubit arguments.
     * @return The position of the argument.
     */
    static int bodyQubit(TerminalNode id, @Nullable TerminalNode index, Map<String, Integer> qargs) {
        Integer pos = qargs.get(id.getText());
        if (pos == null) {
            throw error(id.getSymbol(), "unknown qubit argument " + id.getText());
        }
        if (index != null) {
            throw error(index.getSymbol(), "gate arguments cannot be indexed");
        }
        return pos;
    }

    /**
     * Append the (broadcast) instructions of a top-level gate call.
     *
     * @param name     The name of the called gate.
     * @param gate     The called gate.
     * @param exprs    The parameter expressions.
     * @param operands The qubit operands.
     */
    void gateCall(Token name, ModifiedGate gate, List<Expr> exprs, List<Operand<Qubit>> operands) {
        checkArity(name, gate, exprs.size(), operands.size());
        List<Param> values = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            values.add(expr.evaluate(NO_PARAMS));
        }
        int width = broadcastWidth(name, operands);
        for (int i = 0; i < width; i++) {
            List<Qubit> qubits = select(operands, i);
            checkDistinct(name, qubits);
            for (Instruction insn : gate.call(values, qubits)) {
                circuit.append(insn);
            }
        }
    }

    void measure(Token at, Operand<Qubit> qubits, Operand<Clbit> clbits) {
        if (qubits.bits.size() != clbits.bits.size()) {
            throw error(at, "cannot measure " + qubits.bits.size() + " qubits into "
                    + clbits.bits.size() + " bits");
        }
        for (int i = 0; i < qubits.bits.size(); i++) {
            circuit.append(new Instruction(
                    "measure",
                    Collections.emptyList(),
                    Collections.singletonList(qubits.bits.get(i)),
                    Collections.singletonList(clbits.bits.get(i))));
        }
    }

    void reset(Operand<Qubit> qubits) {
        for (Qubit qubit : qubits.bits) {
            circuit.append(new Instruction(
                    "reset",
                    Collections.emptyList(),
                    Collections.singletonList(qubit),
                    Collections.emptyList()));
        }
    }

    void barrier(Token at, List<Operand<Qubit>> operands) {
        List<Qubit> qubits = new ArrayList<>();
        for (Operand<Qubit> operand : operands) {
            qubits.addAll(operand.bits);
        }
        checkDistinct(at, qubits);
        circuit.append(new Instruction("barrier", Collections.emptyList(), qubits, Collections.emptyList()));
    }

    /**
     * Append a barrier over every qubit declared so far.
     *
     * @param at The barrier keyword.
     */
    void barrierAll(Token at) {
        barrier(at, Collections.singletonList(new Operand<>(circuit.getQubits(), false)));
    }

    private static void checkDistinct(Token at, List<Qubit> qubits) {
        Set<Qubit> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Qubit qubit : qubits) {
            if (!seen.add(qubit)) {
                throw error(at, "duplicate qubit arguments to " + at.getText());
            }
        }
    }

    private static int broadcastWidth(Token at, List<Operand<Qubit>> operands) {
        int width = -1;
        for (Operand<Qubit> operand : operands) {
            if (operand.indexed) continue;
            if (width == -1) {
                width = operand.bits.size();
            } else if (width != operand.bits.size()) {
                throw error(at, "cannot broadcast " + at.getText() + " over registers of different sizes");
            }
        }
        return width == -1 ? 1 : width;
    }

    private static List<Qubit> select(List<Operand<Qubit>> operands, int i) {
        List<Qubit> qubits = new ArrayList<>(operands.size());
        for (Operand<Qubit> operand : operands) {
            qubits.add(operand.indexed ? operand.bits.get(0) : operand.bits.get(i));
        }
        return qubits;
    }

    /**
     * A reference to a whole register, or to one bit of it.
     *
     * @param <T> The type of bits in the register.
     */
    static final class Operand<T> {
        final List<T> bits;
        final boolean indexed;

        Operand(List<T> bits, boolean indexed) {
            this.bits = bits;
            this.indexed = indexed;
        }
    }

    Operand<Qubit> qubits(TerminalNode name, @Nullable TerminalNode index) {
        return operand(qregs, name, index, "quantum register");
    }

    Operand<Clbit> clbits(TerminalNode name, @Nullable TerminalNode index) {
        return operand(cregs, name, index, "classical register");
    }

    boolean isClassicalRegister(String name) {
        return cregs.containsKey(name);
    }

    private static <T> Operand<T> operand(Map<String, List<T>> registers,
                                          TerminalNode name,
                                          @Nullable TerminalNode index,
                                          String what) {
        List<T> reg = registers.get(name.getText());
        if (reg == null) {
            throw error(name.getSymbol(), "unknown " + what + " " + name.getText());
        }
        if (index == null) {
            return new Operand<>(reg, false);
        }
        int i;
        try {
            i = Integer.parseInt(index.getText());
        } catch (NumberFormatException e) {
            i = Integer.MAX_VALUE;
        }
        if (i >= reg.size()) {
            throw error(index.getSymbol(), "index " + index.getText() + " is out of range for "
                    + name.getText() + " of size " + reg.size());
        }
        return new Operand<>(Collections.singletonList(reg.get(i)), true);
    }

    // expressions

    Expr literal(Token value) {
        return Expr.constant(Double.parseDouble(value.getText()));
    }

    /**
     * Resolve a name in an expression: a parameter of the enclosing gate, a circuit input
     * (outside of gates), or a built-in constant.
     *
     * @param id     The name.
     * @param params The parameters of the enclosing gate, or null at the top level.
     * @return The expression.
     */
    Expr identifier(Token id, @Nullable Map<String, Integer> params) {
        String name = id.getText();
        if (params != null) {
            Integer index = params.get(name);
            if (index != null) return Expr.param(index);
        } else if (circuit.getParameters().contains(name)) {
            return Expr.constant(Param.symbol(name));
        }
        Double constant = constants.get(name);
        if (constant != null) {
            return Expr.constant(constant);
        }
        throw error(id, "unknown identifier " + name + " in expression");
    }

    Expr call(Token fn, Expr arg) {
        Param.Function function = functions.get(fn.getText());
        if (function == null) {
            throw error(fn, "unknown function " + fn.getText());
        }
        return vs -> arg.evaluate(vs).apply(function);
    }

    static Expr binary(Param.Operator op, Expr lhs, Expr rhs) {
        switch (op) {
            // @formatter:off
            case ADD: return vs -> lhs.evaluate(vs).plus(rhs.evaluate(vs));
            case SUB: return vs -> lhs.evaluate(vs).minus(rhs.evaluate(vs));
            case MUL: return vs -> lhs.evaluate(vs).times(rhs.evaluate(vs));
            case DIV: return vs -> lhs.evaluate(vs).dividedBy(rhs.evaluate(vs));
            case POW: return vs -> lhs.evaluate(vs).pow(rhs.evaluate(vs));
            // @formatter:on
            default:
                throw new AssertionError(op);
        }
    }

    static Expr negate(Expr operand) {
        return vs -> operand.evaluate(vs).negate();
    }

    /**
     * Evaluate the argument of a modifier, which must be a number known before any input is bound.
     *
     * @param at   The modifier keyword.
     * @param expr The argument.
     * @return The value.
     */
    static double constantArgument(Token at, Expr expr) {
        Param value = expr.evaluate(NO_PARAMS);
        if (!value.isNumeric()) {
            throw error(at, "argument of " + at.getText() + " must be a constant, got " + value);
        }
        return value.getValue();
    }

    static int controlCount(Token at, Expr expr) {
        double value = constantArgument(at, expr);
        if (value != Math.rint(value) || value < 1 || value > Integer.MAX_VALUE) {
            throw error(at, "argument of " + at.getText() + " must be a positive integer, got " + value);
        }
        return (int) value;
    }
}
