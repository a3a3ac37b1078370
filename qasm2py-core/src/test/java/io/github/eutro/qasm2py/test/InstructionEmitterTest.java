package io.github.eutro.qasm2py.test;

import io.github.eutro.qasm2py.core.emit.InstructionEmitter;
import io.github.eutro.qasm2py.core.emit.InstructionShape;
import io.github.eutro.qasm2py.core.gates.StandardGates;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.ControlInfo;
import io.github.eutro.qasm2py.core.ir.Instruction;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.util.Lazy;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class InstructionEmitterTest {
    private static final int[] NONE = new int[0];

    private static Instruction insn(String name, double... params) {
        return insn(name, null, params);
    }

    private static Instruction insn(String name, @Nullable ControlInfo controlInfo, double... params) {
        List<Param> values = new ArrayList<>();
        for (double param : params) values.add(Param.of(param));
        return new Instruction(name, values,
                Collections.emptyList(), Collections.emptyList(),
                null, controlInfo);
    }

    private static String emit(Instruction insn, int[] qubits, int[] clbits) {
        List<String> lines = InstructionEmitter.emit(insn, "qc", qubits, clbits, "");
        assertEquals(1, lines.size());
        return lines.get(0);
    }

    private static String emit(Instruction insn, int... qubits) {
        return emit(insn, qubits, NONE);
    }

    @Test
    void testSimpleGates() {
        assertEquals("qc.h(0)", emit(insn("h"), 0));
        assertEquals("qc.id(2)", emit(insn("id"), 2));
        assertEquals("qc.id(2)", emit(insn("i"), 2));
        assertEquals("qc.sxdg(1)", emit(insn("sxdg"), 1));
        assertEquals("qc.rx(0.5, 1)", emit(insn("rx", 0.5), 1));
        assertEquals("qc.p(1e-05, 0)", emit(insn("p", 1e-5), 0));
        assertEquals("qc.u(0.1, 0.2, 0.3, 4)", emit(insn("u", 0.1, 0.2, 0.3), 4));
        assertEquals("qc.swap(3, 1)", emit(insn("swap"), 3, 1));
        assertEquals("qc.cz(0, 1)", emit(insn("cz"), 0, 1));
        assertEquals("qc.crx(0.25, 1, 0)", emit(insn("crx", 0.25), 1, 0));
        assertEquals("qc.ccx(2, 0, 1)", emit(insn("ccx"), 2, 0, 1));
        assertEquals("qc.mcx([0, 1, 2], 3)", emit(insn("mcx"), 0, 1, 2, 3));
    }

    @Test
    void testNonGateInstructions() {
        assertEquals("qc.measure(1, 0)", emit(insn("measure"), new int[]{1}, new int[]{0}));
        assertEquals("qc.barrier([0, 2])", emit(insn("barrier"), 0, 2));
        assertEquals("qc.barrier([])", emit(insn("barrier")));
        assertEquals("qc.reset(1)", emit(insn("reset"), 1));
    }

    @Test
    void testControlled() {
        ControlInfo cx = new ControlInfo(1, "x");
        ControlInfo ccx = new ControlInfo(2, "x");
        assertEquals("qc.cx(0, 1)", emit(insn("cx", cx), 0, 1));
        assertEquals("qc.ccx(0, 1, 2)", emit(insn("ccx", ccx), 0, 1, 2));
        assertEquals("qc.mcx([0, 1, 2], 3)", emit(insn("c3x", new ControlInfo(3, "x")), 0, 1, 2, 3));
        // controlled gates with other bases are written as multi-controlled x
        assertEquals("qc.mcx([0], 1)", emit(insn("crz", new ControlInfo(1, "rz"), 1.5), 0, 1));
        assertEquals("qc.mcx([0], 1)", emit(insn("ch", new ControlInfo(1, "h")), 0, 1));
    }

    @Test
    void testControlledYAndZ() {
        assertEquals("qc.mcx([0], 1)", emit(insn("cy", new ControlInfo(1, "y")), 0, 1));
        assertEquals("qc.mcx([0], 1)", emit(insn("cz", new ControlInfo(1, "z")), 0, 1));
    }

    @Test
    void testOpenControls() {
        assertEquals("qc.cx(0, 1, ctrl_state=0)",
                emit(insn("cx_o0", new ControlInfo(1, "x", BigInteger.ZERO)), 0, 1));
        assertEquals("qc.ccx(0, 1, 2, ctrl_state=2)",
                emit(insn("ccx_o2", new ControlInfo(2, "x", BigInteger.valueOf(2))), 0, 1, 2));
        assertEquals("qc.mcx([0, 1], 2, ctrl_state=1)",
                emit(insn("c2h_o1", new ControlInfo(2, "h", BigInteger.ONE)), 0, 1, 2));
        assertEquals("qc.ccx(0, 1, 2)",
                emit(insn("ccx", new ControlInfo(2, "x", BigInteger.valueOf(3))), 0, 1, 2));
    }

    @Test
    void testSymbolicParams() {
        Param theta = Param.symbol("theta");
        Instruction rz = new Instruction("rz", Collections.singletonList(theta.dividedBy(Param.of(2))),
                Collections.emptyList(), Collections.emptyList());
        assertEquals("qc.rz(theta / 2.0, 0)", emit(rz, 0));
        Instruction u = new Instruction("u", Arrays.asList(theta, Param.of(0), theta.negate()),
                Collections.emptyList(), Collections.emptyList());
        assertEquals("qc.u(theta, 0.0, -theta, 1)", emit(u, 1));
    }

    @Test
    void testMcxBoundary() {
        assertEquals("qc.mcx([], 0)", emit(insn("mcx"), 0));
        assertEquals("# Unsupported gate: mcx params=[] qubits=[]", emit(insn("mcx")));
        // too few qubits for the declared controls
        assertEquals("qc.mcx([], 5)", emit(insn("cx", new ControlInfo(1, "x")), 5));
        assertEquals("qc.mcx([0], 1)", emit(insn("ccx", new ControlInfo(2, "x")), 0, 1));
        assertEquals("# Unsupported gate: cx params=[] qubits=[]", emit(insn("cx", new ControlInfo(1, "x"))));
    }

    @Test
    void testCustomGate() {
        Circuit def = new Circuit("bell");
        Instruction call = new Instruction("bell", Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList(),
                Lazy.of(def), null);
        assertEquals("qc.append(build_bell(), [2, 0])", emit(call, 2, 0));
    }

    @Test
    void testPrimitiveWithDefinitionFallsBack() {
        Instruction u1 = new Instruction("u1", Collections.singletonList(Param.of(0.5)),
                Collections.emptyList(), Collections.emptyList(),
                Lazy.of(new Circuit("u1")), null);
        assertEquals("# Unsupported gate: u1 params=[0.5] qubits=[0]", emit(u1, 0));
    }

    @Test
    void testFallback() {
        assertEquals("# Unsupported gate: global_phase params=[0.5] qubits=[]", emit(insn("global_phase", 0.5)));
        assertEquals("# Unsupported gate: magic params=[] qubits=[0, 1]", emit(insn("magic"), 0, 1));
        // malformed arities never throw
        assertEquals("# Unsupported gate: u params=[0.1, 0.2] qubits=[0]", emit(insn("u", 0.1, 0.2), 0));
        assertEquals("# Unsupported gate: rx params=[] qubits=[0]", emit(insn("rx"), 0));
        assertEquals("# Unsupported gate: measure params=[] qubits=[0]", emit(insn("measure"), 0));
        assertEquals("# Unsupported gate: h params=[] qubits=[]", emit(insn("h")));
        assertEquals("# Unsupported gate: cx params=[] qubits=[0]", emit(insn("cx"), 0));
    }

    @Test
    void testIndent() {
        assertEquals(Collections.singletonList("    g.h(0)"),
                InstructionEmitter.emit(insn("h"), "g", new int[]{0}, NONE, "    "));
        assertEquals(Collections.singletonList("    # Unsupported gate: magic params=[] qubits=[]"),
                InstructionEmitter.emit(insn("magic"), "g", NONE, NONE, "    "));
    }

    @Test
    void testEveryPrimitiveHasAShape() {
        Set<String> unemitted = new HashSet<>(Arrays.asList("u1", "u2", "u3", "cu", "cswap", "rzz"));
        int[] qubits = {0, 1, 2};
        for (String name : StandardGates.PRIMITIVE_GATES) {
            InstructionShape shape = InstructionShape.of(insn(name, 0.1, 0.2, 0.3), qubits, NONE);
            if (unemitted.contains(name)) {
                assertEquals(InstructionShape.UNSUPPORTED, shape, name);
            } else {
                assertNotEquals(InstructionShape.UNSUPPORTED, shape, name);
            }
        }
    }
}
