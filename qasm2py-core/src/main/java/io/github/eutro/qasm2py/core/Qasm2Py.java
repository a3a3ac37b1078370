package io.github.eutro.qasm2py.core;

import io.github.eutro.qasm2py.core.conf.TranslationOptions;
import io.github.eutro.qasm2py.core.parse.CircuitLoader;
import io.github.eutro.qasm2py.core.passes.AssembleProgram;
import org.jetbrains.annotations.NotNull;

/**
 * Static entry points translating OpenQASM source to Python in one call.
 * <p>
 * For more control, see {@code QasmTranslator} in the API module, or compose
 * {@link CircuitLoader} with {@link AssembleProgram} directly.
 */
public final class Qasm2Py {
    private Qasm2Py() {
    }

    /**
     * Translate with the default options.
     *
     * @param source The OpenQASM source.
     * @return The Python program.
     * @see #translate(String, String, boolean)
     */
    @NotNull
    public static String translate(@NotNull String source) {
        return translate(source, TranslationOptions.DEFAULT);
    }

    /**
     * Translate, including the import line.
     *
     * @param source       The OpenQASM source.
     * @param variableName The name of the main circuit variable.
     * @return The Python program.
     * @see #translate(String, String, boolean)
     */
    @NotNull
    public static String translate(@NotNull String source, @NotNull String variableName) {
        return translate(source, variableName, true);
    }

    /**
     * Translate OpenQASM 2 or OpenQASM 3 source to a Python program that rebuilds the
     * circuit with Qiskit.
     *
     * @param source         The OpenQASM source.
     * @param variableName   The name of the main circuit variable.
     * @param includeImports Whether to start with the import line.
     * @return The Python program, lines separated by {@code \n}.
     * @throws io.github.eutro.qasm2py.core.parse.CircuitLoadException If the source cannot be loaded.
     */
    @NotNull
    public static String translate(@NotNull String source, @NotNull String variableName, boolean includeImports) {
        return translate(source, TranslationOptions.builder()
                .setVariableName(variableName)
                .setIncludeImports(includeImports)
                .build());
    }

    /**
     * Translate with the given options.
     *
     * @param source  The OpenQASM source.
     * @param options The options.
     * @return The Python program.
     */
    @NotNull
    public static String translate(@NotNull String source, @NotNull TranslationOptions options) {
        return CircuitLoader.INSTANCE
                .then(new AssembleProgram(options))
                .run(source)
                .text();
    }
}
