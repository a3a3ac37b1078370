package io.github.eutro.qasm2py;

import io.github.eutro.qasm2py.api.QasmTranslator;
import io.github.eutro.qasm2py.api.Translation;
import io.github.eutro.qasm2py.api.bits.Bit;
import io.github.eutro.qasm2py.api.bits.ProgramsToDirectory;
import io.github.eutro.qasm2py.api.events.*;
import io.github.eutro.qasm2py.core.Qasm2Py;
import io.github.eutro.qasm2py.core.emit.EmittedProgram;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.parse.UnknownDialectException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class QasmTranslatorTest {
    static final String BELL = "OPENQASM 2.0;\n"
            + "include \"qelib1.inc\";\n"
            + "qreg q[2];\n"
            + "creg c[2];\n"
            + "h q[0];\n"
            + "cx q[0], q[1];\n"
            + "measure q -> c;\n";

    @Test
    void testOutputsAsQueue() {
        QasmTranslator cc = new QasmTranslator();
        BlockingQueue<EmittedProgram> queue = cc.outputsAsQueue();
        cc.submitText(BELL).run();
        cc.submitText("OPENQASM 3.0;\n").run();
        assertEquals(2, queue.size());
        assertEquals(Qasm2Py.translate(BELL), queue.remove().text());
        assertEquals(Qasm2Py.translate("OPENQASM 3.0;\n"), queue.remove().text());
    }

    @Test
    void testAddBit() {
        QasmTranslator cc = new QasmTranslator();
        Bit<QasmTranslator, BlockingQueue<EmittedProgram>> collect = QasmTranslator::outputsAsQueue;
        BlockingQueue<EmittedProgram> queue = cc.add(collect);
        Bit<QasmTranslator, Collection<EmittedProgram>> readOnly =
                collect.andThen(Collections::unmodifiableCollection);
        Collection<EmittedProgram> view = cc.add(readOnly);
        cc.submitText(BELL).run();
        assertEquals(1, queue.size());
        assertEquals(1, view.size());
        assertThrows(UnsupportedOperationException.class, view::clear);
    }

    @Test
    void testFilteredListener() {
        QasmTranslator cc = new QasmTranslator();
        List<String> names = new ArrayList<>();
        cc.lift().listen(EmitProgramEvent.class, evt -> evt.name != null, evt -> names.add(evt.name));
        cc.submitText(BELL).run();
        Translation named = cc.submitText(BELL);
        named.setName("bell");
        named.run();
        assertEquals(Collections.singletonList("bell"), names);
    }

    @Test
    void testHasListeners() {
        QasmTranslator cc = new QasmTranslator();
        assertFalse(cc.hasListeners(NewTranslationEvent.class));
        cc.listen(NewTranslationEvent.class, evt -> {});
        assertTrue(cc.hasListeners(NewTranslationEvent.class));
        assertFalse(cc.hasListeners(RunTranslationEvent.class));
    }

    @Test
    void testOptions() {
        QasmTranslator cc = new QasmTranslator();
        BlockingQueue<EmittedProgram> queue = cc.outputsAsQueue();
        cc.submitText(BELL)
                .setVariableName("bell")
                .setIncludeImports(false)
                .run();
        assertEquals(Qasm2Py.translate(BELL, "bell", false), queue.remove().text());

        cc.lift().listen(ModifyOptionsEvent.class, evt -> evt.optionsBuilder.setVariableName("circ"));
        cc.submitText(BELL).run();
        assertTrue(queue.remove().getLines().contains("circ = QuantumCircuit(2, 2)"));
    }

    @Test
    void testEventOrder() {
        QasmTranslator cc = new QasmTranslator();
        List<String> fired = new ArrayList<>();
        cc.listen(NewTranslationEvent.class, evt -> fired.add("new"));
        cc.listen(RunTranslationEvent.class, evt -> fired.add("run"));
        EventDispatcher<TranslationEvent> lifted = cc.lift();
        lifted.listen(ModifyOptionsEvent.class, evt -> fired.add("options"));
        lifted.listen(ReceiveCircuitEvent.class, evt -> fired.add("circuit"));
        lifted.listen(CustomGatesEvent.class, evt -> fired.add("gates"));
        lifted.listen(EmitProgramEvent.class, evt -> fired.add("emit"));

        Translation translation = cc.submitText(BELL);
        assertEquals(Arrays.asList("new"), fired);
        translation.run();
        assertEquals(Arrays.asList("new", "run", "options", "circuit", "gates", "emit"), fired);
    }

    @Test
    void testReplaceCircuit() {
        QasmTranslator cc = new QasmTranslator();
        cc.lift().listen(ReceiveCircuitEvent.class, evt -> evt.circuit = new Circuit(null));
        BlockingQueue<EmittedProgram> queue = cc.outputsAsQueue();
        cc.submitText(BELL).setIncludeImports(false).run();
        assertEquals("qc = QuantumCircuit(0, 0)\n", queue.remove().text());
    }

    @Test
    void testCustomGatesEvent() {
        QasmTranslator cc = new QasmTranslator();
        List<String> seen = new ArrayList<>();
        cc.lift().listen(CustomGatesEvent.class, evt -> seen.addAll(evt.customGates.names()));
        cc.submitText("OPENQASM 2.0;\n"
                + "include \"qelib1.inc\";\n"
                + "gate bell a, b { h a; cx a, b; }\n"
                + "qreg q[2];\n"
                + "bell q[0], q[1];\n").run();
        assertEquals(Arrays.asList("bell"), seen);
    }

    @Test
    void testCancelEmit() {
        QasmTranslator cc = new QasmTranslator();
        AtomicInteger emitted = new AtomicInteger();
        cc.lift().listen(EmitProgramEvent.class, EmitProgramEvent::cancel);
        cc.lift().listen(EmitProgramEvent.class, evt -> emitted.incrementAndGet());
        BlockingQueue<EmittedProgram> queue = cc.outputsAsQueue();
        cc.submitText(BELL).run();
        assertEquals(0, emitted.get());
        assertTrue(queue.isEmpty());
    }

    @Test
    void testRunOnce() {
        Translation translation = new QasmTranslator().submitText(BELL);
        translation.run();
        assertThrows(IllegalStateException.class, translation::run);
    }

    @Test
    void testLoadErrorsPropagate() {
        QasmTranslator cc = new QasmTranslator();
        BlockingQueue<EmittedProgram> queue = cc.outputsAsQueue();
        assertThrows(UnknownDialectException.class, () -> cc.submitText("qreg q[2];").run());
        assertTrue(queue.isEmpty());
    }

    @Test
    void testProgramsToDirectory(@TempDir Path dir) throws IOException {
        Path source = dir.resolve("bell.qasm");
        Files.write(source, BELL.getBytes(StandardCharsets.UTF_8));
        Path out = dir.resolve("out");

        QasmTranslator cc = new QasmTranslator();
        new ProgramsToDirectory<>(out).addTo(cc.lift());
        cc.submitFile(source).run();
        cc.submitText("OPENQASM 3.0;\n").run();
        cc.submitText("OPENQASM 3.0;\nqubit q;\n").setName("single").run();

        assertEquals(Qasm2Py.translate(BELL) + "\n",
                new String(Files.readAllBytes(out.resolve("bell.py")), StandardCharsets.UTF_8));
        assertTrue(Files.exists(out.resolve(ProgramsToDirectory.DEFAULT_NAME + ".py")));
        assertTrue(Files.exists(out.resolve("single.py")));
    }
}
