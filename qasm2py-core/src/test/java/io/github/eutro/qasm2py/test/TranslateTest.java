package io.github.eutro.qasm2py.test;

import io.github.eutro.qasm2py.core.Qasm2Py;
import io.github.eutro.qasm2py.core.conf.TranslationOptions;
import io.github.eutro.qasm2py.core.emit.EmittedProgram;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Instruction;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.parse.CircuitLoader;
import io.github.eutro.qasm2py.core.parse.UnknownDialectException;
import io.github.eutro.qasm2py.core.passes.AssembleProgram;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class TranslateTest {
    @Test
    void testBell() throws IOException {
        String out = Qasm2Py.translate(Utils.getSource("bell.qasm"));
        assertEquals(Arrays.asList(
                "from qiskit import QuantumCircuit",
                "",
                "qc = QuantumCircuit(2, 2)",
                "",
                "qc.h(0)",
                "qc.cx(0, 1)"
        ), Utils.lines(out));
    }

    @Test
    void testEmptyCircuit() {
        assertEquals("from qiskit import QuantumCircuit\n\nqc = QuantumCircuit(0, 0)\n",
                Qasm2Py.translate("OPENQASM 3.0;\n"));
        assertEquals("qc = QuantumCircuit(2, 1)\n",
                Qasm2Py.translate("OPENQASM 2.0;\nqreg q[2];\ncreg c[1];\n", "qc", false));
    }

    @Test
    void testOptions() throws IOException {
        String source = Utils.getSource("bell.qasm");
        assertEquals(Arrays.asList(
                "circ = QuantumCircuit(2, 2)",
                "",
                "circ.h(0)",
                "circ.cx(0, 1)"
        ), Utils.lines(Qasm2Py.translate(source, "circ", false)));
        assertTrue(Qasm2Py.translate(source, "circ").startsWith("from qiskit import QuantumCircuit\n\ncirc = "));
        assertThrows(IllegalArgumentException.class, () -> Qasm2Py.translate(source, "not a name"));
    }

    @Test
    void testCustomGates() throws IOException {
        assertEquals(Arrays.asList(
                "from qiskit import QuantumCircuit",
                "",
                "def build_outer():",
                "    g = QuantumCircuit(2, name='outer')",
                "    g.append(build_inner(), [0])",
                "    g.cx(0, 1)",
                "    return g.to_gate()",
                "",
                "def build_inner():",
                "    g = QuantumCircuit(1, name='inner')",
                "    g.h(0)",
                "    return g.to_gate()",
                "",
                "qc = QuantumCircuit(2, 0)",
                "",
                "qc.append(build_outer(), [0, 1])"
        ), Utils.lines(Qasm2Py.translate(Utils.getSource("nested.qasm"))));
    }

    @Test
    void testDeduplicatedBuilders() {
        String out = Qasm2Py.translate("OPENQASM 2.0;\n"
                + "include \"qelib1.inc\";\n"
                + "gate g a, b { cx b, a; }\n"
                + "qreg q[3];\n"
                + "g q[0], q[1];\n"
                + "g q[1], q[2];\n"
                + "g q[2], q[0];\n", "qc", false);
        assertEquals(Arrays.asList(
                "def build_g():",
                "    g = QuantumCircuit(2, name='g')",
                "    g.cx(1, 0)",
                "    return g.to_gate()",
                "",
                "qc = QuantumCircuit(3, 0)",
                "",
                "qc.append(build_g(), [0, 1])",
                "qc.append(build_g(), [1, 2])",
                "qc.append(build_g(), [2, 0])"
        ), Utils.lines(out));
    }

    @Test
    void testRegressions() {
        String out = Qasm2Py.translate("OPENQASM 3.0;\n"
                + "include \"stdgates.inc\";\n"
                + "qubit[2] q;\n"
                + "cy q[0], q[1];\n"
                + "cz q[1], q[0];\n"
                + "u1(0.5) q[0];\n"
                + "gphase(0.25);\n", "qc", false);
        assertEquals(Arrays.asList(
                "qc = QuantumCircuit(2, 0)",
                "",
                "qc.mcx([0], 1)",
                "qc.mcx([1], 0)",
                "# Unsupported gate: u1 params=[0.5] qubits=[0]",
                "# Unsupported gate: global_phase params=[0.25] qubits=[]"
        ), Utils.lines(out));
    }

    @Test
    void testDeterministic() throws IOException {
        String source = Utils.getSource("nested.qasm") + "\nrxx(0.5) q[1], q[0];\nouter q[1], q[0];\n";
        String first = Qasm2Py.translate(source);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, Qasm2Py.translate(source));
        }
    }

    @Test
    void testErrorsPropagate() {
        assertThrows(UnknownDialectException.class, () -> Qasm2Py.translate("h q[0];"));
    }

    private static final Pattern STATEMENT = Pattern.compile("qc\\.(\\w+)\\((.*)\\)");

    @Test
    void testStructuralRoundTrip() throws IOException {
        Circuit circuit = CircuitLoader.load(Utils.getSource("primitives.qasm"));
        EmittedProgram program = new AssembleProgram(TranslationOptions.DEFAULT).run(circuit);
        List<String> lines = program.getLines();

        int declaration = lines.indexOf("qc = QuantumCircuit(" + circuit.getNumQubits() + ", "
                + circuit.getNumClbits() + ")");
        assertEquals(2, declaration);
        List<String> body = lines.subList(declaration + 2, lines.size());
        assertEquals(circuit.getInstructions().size(), body.size());

        for (int i = 0; i < body.size(); i++) {
            Instruction insn = circuit.getInstructions().get(i);
            Matcher m = STATEMENT.matcher(body.get(i));
            assertTrue(m.matches(), body.get(i));
            assertEquals(insn.getName(), m.group(1));

            List<Double> expected = new ArrayList<>();
            for (Param param : insn.getParams()) expected.add(param.getValue());
            for (int q : circuit.qubitIndices(insn)) expected.add((double) q);
            for (int c : circuit.clbitIndices(insn)) expected.add((double) c);

            List<Double> actual = new ArrayList<>();
            String args = m.group(2).replace("[", "").replace("]", "");
            if (!args.isEmpty()) {
                for (String arg : args.split(", ")) {
                    actual.add(Double.parseDouble(arg));
                }
            }
            assertEquals(expected, actual, body.get(i));
        }
    }

    @Test
    void testPrimitivesProgram() throws IOException {
        assertEquals(Arrays.asList(
                "qc = QuantumCircuit(3, 3)",
                "",
                "qc.h(0)",
                "qc.x(1)",
                "qc.rx(0.25, 2)",
                "qc.cx(0, 2)",
                "qc.swap(1, 2)",
                "qc.u(0.1, 0.2, 0.3, 0)",
                "qc.ccx(0, 1, 2)",
                "qc.barrier([0, 1])",
                "qc.reset(1)",
                "qc.measure(0, 0)",
                "qc.measure(1, 1)"
        ), Utils.lines(Qasm2Py.translate(Utils.getSource("primitives.qasm"), "qc", false)));
    }

    @Test
    void testSanitizedProgram() throws IOException {
        assertEquals(Arrays.asList(
                "qc = QuantumCircuit(2, 0)",
                "",
                "qc.h(0)",
                "qc.sx(1)"
        ), Utils.lines(Qasm2Py.translate(Utils.getSource("modifiers.qasm"), "qc", false)));
    }

    @Test
    void testControlModifiers() {
        String out = Qasm2Py.translate("OPENQASM 3.0;\n"
                + "include \"stdgates.inc\";\n"
                + "qubit[3] q;\n"
                + "ctrl @ x q[0], q[1];\n"
                + "ctrl(2) @ x q[0], q[1], q[2];\n"
                + "ctrl @ h q[0], q[1];\n"
                + "negctrl @ x q[1], q[0];\n"
                + "ctrl @ negctrl @ x q[0], q[1], q[2];\n"
                + "ctrl @ cx q[2], q[0], q[1];\n", "qc", false);
        assertEquals(Arrays.asList(
                "qc = QuantumCircuit(3, 0)",
                "",
                "qc.cx(0, 1)",
                "qc.ccx(0, 1, 2)",
                "qc.mcx([0], 1)",
                "qc.cx(1, 0, ctrl_state=0)",
                "qc.ccx(0, 1, 2, ctrl_state=1)",
                "qc.ccx(2, 0, 1)"
        ), Utils.lines(out));
    }

    @Test
    void testInverseAndPowerModifiers() {
        String out = Qasm2Py.translate("OPENQASM 3.0;\n"
                + "include \"stdgates.inc\";\n"
                + "qubit[2] q;\n"
                + "inv @ h q[0];\n"
                + "pow(2) @ rz(0.5) q[1];\n"
                + "inv @ s q[0];\n"
                + "inv @ pow(2) @ t q[1];\n"
                + "pow(0.5) @ rx(1.0) q[0];\n"
                + "inv @ U(0.1, 0.2, 0.3) q[0];\n"
                + "pow(0) @ x q[1];\n", "qc", false);
        assertEquals(Arrays.asList(
                "qc = QuantumCircuit(2, 0)",
                "",
                "qc.h(0)",
                "qc.rz(1.0, 1)",
                "qc.sdg(0)",
                "qc.tdg(1)",
                "qc.tdg(1)",
                "qc.rx(0.5, 0)",
                "qc.u(-0.1, -0.3, -0.2, 0)"
        ), Utils.lines(out));
    }

    @Test
    void testInputParameters() {
        String out = Qasm2Py.translate("OPENQASM 3.0;\n"
                + "include \"stdgates.inc\";\n"
                + "input float theta;\n"
                + "input angle[32] phi;\n"
                + "qubit[2] q;\n"
                + "rx(theta) q[0];\n"
                + "rz(2 * theta + pi) q[1];\n"
                + "crz(-phi) q[0], q[1];\n"
                + "ry(cos(theta)) q[1];\n");
        assertEquals(Arrays.asList(
                "from qiskit import QuantumCircuit",
                "from qiskit.circuit import Parameter",
                "",
                "theta = Parameter('theta')",
                "phi = Parameter('phi')",
                "",
                "qc = QuantumCircuit(2, 0)",
                "",
                "qc.rx(theta, 0)",
                "qc.rz((2.0 * theta) + 3.141592653589793, 1)",
                "qc.crz(-phi, 0, 1)",
                "qc.ry(theta.cos(), 1)"
        ), Utils.lines(out));
    }

    @Test
    void testConditionDropped() {
        String out = Qasm2Py.translate("OPENQASM 2.0;\n"
                + "include \"qelib1.inc\";\n"
                + "qreg q[1];\n"
                + "creg c[1];\n"
                + "measure q[0] -> c[0];\n"
                + "if (c==1) x q[0];\n", "qc", false);
        assertEquals(Arrays.asList(
                "qc = QuantumCircuit(1, 1)",
                "",
                "qc.measure(0, 0)",
                "qc.x(0)"
        ), Utils.lines(out));
    }

    @Test
    void testTextJoinsLines() {
        EmittedProgram program = new EmittedProgram(Arrays.asList("a", "", "b"));
        assertEquals("a\n\nb", program.text());
        assertEquals(program.text(), program.toString());
        assertEquals(new EmittedProgram(Arrays.asList("a", "", "b")), program);
        assertEquals("", new EmittedProgram(Collections.emptyList()).text());
    }
}
