package io.github.eutro.qasm2py;

import io.github.eutro.qasm2py.core.Qasm2Py;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        try (PrintStream out = new PrintStream(outBytes, true, "UTF-8");
             PrintStream err = new PrintStream(errBytes, true, "UTF-8")) {
            return Cli.run(args, out, err);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private static Path bell(Path dir) throws IOException {
        Path source = dir.resolve("bell.qasm");
        Files.write(source, QasmTranslatorTest.BELL.getBytes(StandardCharsets.UTF_8));
        return source;
    }

    @Test
    void testHelp() {
        assertEquals(0, run("--help"));
        assertTrue(out().startsWith("usage: qasm2py"));
        assertEquals(1, run());
        assertTrue(err().startsWith("usage: qasm2py"));
    }

    @Test
    void testBadFlags() {
        assertEquals(1, run("--frobnicate", "x.qasm"));
        assertTrue(err().contains("--frobnicate: unknown flag"));
        assertEquals(1, run("x.qasm", "-o"));
        assertEquals(1, run("-o", "a", "-o", "b", "x.qasm"));
    }

    @Test
    void testPrintsProgram(@TempDir Path dir) throws IOException {
        Path source = bell(dir);
        assertEquals(0, run("-n", "circ", "--no-imports", source.toString()));
        assertEquals(Qasm2Py.translate(QasmTranslatorTest.BELL, "circ", false) + System.lineSeparator(), out());
        assertEquals("", err());
    }

    @Test
    void testOutputDirectory(@TempDir Path dir) throws IOException {
        Path source = bell(dir);
        Path out = dir.resolve("generated");
        assertEquals(0, run("--output", out.toString(), "--", source.toString()));
        assertEquals(Qasm2Py.translate(QasmTranslatorTest.BELL) + "\n",
                new String(Files.readAllBytes(out.resolve("bell.py")), StandardCharsets.UTF_8));
        assertEquals("", out());
    }

    @Test
    void testErrors(@TempDir Path dir) throws IOException {
        assertEquals(1, run(dir.resolve("missing.qasm").toString()));
        assertTrue(err().contains("could not read or write file"));

        Path bad = dir.resolve("bad.qasm");
        Files.write(bad, "qreg q[1];\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, run(bad.toString()));
        assertTrue(err().contains("neither OPENQASM 3 nor OPENQASM 2"));

        assertEquals(1, run("-n", "not valid", bell(dir).toString()));
        assertTrue(err().contains("not a valid variable name"));
    }
}
