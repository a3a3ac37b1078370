package io.github.eutro.qasm2py.core.parse;

import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.passes.IRPass;
import org.jetbrains.annotations.NotNull;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads OpenQASM 2 or OpenQASM 3 source into a {@link Circuit}.
 * <p>
 * OpenQASM 3 source that does not parse is retried once after
 * {@link ModifierSanitizer#sanitize(String) stripping gate modifiers}.
 */
public final class CircuitLoader implements IRPass<String, Circuit> {
    private static final Logger LOG = Logger.getLogger(CircuitLoader.class.getName());

    public static final CircuitLoader INSTANCE = new CircuitLoader();

    private CircuitLoader() {
    }

    /**
     * Load a circuit.
     *
     * @param source The OpenQASM source.
     * @return The circuit.
     * @throws UnknownDialectException If the dialect of the source could not be detected.
     * @throws DialectParseException   If the source failed to parse.
     */
    @NotNull
    public static Circuit load(@NotNull String source) {
        Dialect dialect = Dialect.detect(source);
        if (dialect == null) {
            throw new UnknownDialectException("source declares neither "
                    + Dialect.OPENQASM_3 + " nor " + Dialect.OPENQASM_2);
        }
        LOG.fine(() -> "loading source as " + dialect);
        try {
            return dialect.parse(source);
        } catch (QasmSyntaxException e) {
            if (dialect != Dialect.OPENQASM_3) {
                throw new DialectParseException(dialect, e);
            }
            LOG.log(Level.WARNING, "source failed to parse ({0}), retrying with gate modifiers removed;"
                    + " the resulting circuit may differ from the source", e.getMessage());
            try {
                return dialect.parse(ModifierSanitizer.sanitize(source));
            } catch (QasmSyntaxException e2) {
                DialectParseException ex = new DialectParseException(dialect, e2);
                ex.addSuppressed(e);
                throw ex;
            }
        }
    }

    @Override
    public Circuit run(String source) {
        return load(source);
    }
}
