package io.github.eutro.qasm2py.core.parse;

import io.github.eutro.qasm2py.core.gates.GateDefinition;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Function;

/**
 * The standard include files, bundled as resources next to this class.
 * <p>
 * Each file is parsed at most once per class loader, when a program first includes it.
 */
final class Includes {
    private Includes() {
    }

    static final String QELIB1 = "qelib1.inc";
    static final String STDGATES = "stdgates.inc";

    private static final class Qelib1 {
        static final Map<String, GateDefinition> GATES = read(QELIB1, Qasm2Builder::parseLibrary);
    }

    private static final class Stdgates {
        static final Map<String, GateDefinition> GATES = read(STDGATES, Qasm3Builder::parseLibrary);
    }

    /**
     * Get the gates of {@code qelib1.inc}, the OpenQASM 2 standard library.
     *
     * @return The gates, by source name.
     */
    static Map<String, GateDefinition> qelib1() {
        return Qelib1.GATES;
    }

    /**
     * Get the gates of {@code stdgates.inc}, the OpenQASM 3 standard library.
     *
     * @return The gates, by source name.
     */
    static Map<String, GateDefinition> stdgates() {
        return Stdgates.GATES;
    }

    private static Map<String, GateDefinition> read(@NotNull String file,
                                                    Function<String, Map<String, GateDefinition>> parse) {
        try (InputStream stream = Includes.class.getResourceAsStream(file)) {
            if (stream == null) {
                throw new IllegalStateException("missing bundled include file " + file);
            }
            String source = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            try {
                return parse.apply(source);
            } catch (QasmSyntaxException e) {
                throw new IllegalStateException("bundled include file " + file + " is invalid", e);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
