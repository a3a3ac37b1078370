package io.github.eutro.qasm2py.core.parse;

import io.github.eutro.qasm2py.core.ir.Circuit;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The OpenQASM dialects that can be loaded.
 */
public enum Dialect {
    OPENQASM_2("OPENQASM 2") {
        @Override
        Circuit parse(@NotNull String source) {
            return Qasm2Builder.parseProgram(source);
        }
    },
    OPENQASM_3("OPENQASM 3") {
        @Override
        Circuit parse(@NotNull String source) {
            return Qasm3Builder.parseProgram(source);
        }
    },
    ;

    private final String marker;

    Dialect(String marker) {
        this.marker = marker;
    }

    /**
     * Get the text that identifies source of this dialect, the start of its version header.
     *
     * @return The marker.
     */
    public String getMarker() {
        return marker;
    }

    /**
     * Parse a program of this dialect.
     *
     * @param source The source.
     * @return The circuit.
     * @throws QasmSyntaxException If the source does not parse.
     */
    abstract Circuit parse(@NotNull String source);

    /**
     * Detect the dialect of some source.
     * <p>
     * The first non-blank line is checked for a version header. If it has none, the whole
     * text is searched for a marker, OpenQASM 3 taking precedence.
     *
     * @param source The source.
     * @return The dialect, or null if none could be detected.
     */
    @Nullable
    public static Dialect detect(@NotNull String source) {
        for (String line : source.split("\r?\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            if (trimmed.startsWith(OPENQASM_3.marker)) return OPENQASM_3;
            if (trimmed.startsWith(OPENQASM_2.marker)) return OPENQASM_2;
            break;
        }
        if (source.contains(OPENQASM_3.marker)) return OPENQASM_3;
        if (source.contains(OPENQASM_2.marker)) return OPENQASM_2;
        return null;
    }

    @Override
    public String toString() {
        return getMarker();
    }
}
