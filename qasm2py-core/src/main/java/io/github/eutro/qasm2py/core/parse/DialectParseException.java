package io.github.eutro.qasm2py.core.parse;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when source of a recognised dialect fails to parse.
 * The cause is the {@link QasmSyntaxException} describing the failure.
 */
public class DialectParseException extends CircuitLoadException {
    private final Dialect dialect;

    public DialectParseException(@NotNull Dialect dialect, @NotNull QasmSyntaxException cause) {
        super("failed to parse " + dialect + " source: " + cause.getMessage(), cause);
        this.dialect = dialect;
    }

    /**
     * Get the dialect the source was parsed as.
     *
     * @return The dialect.
     */
    @NotNull
    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public synchronized QasmSyntaxException getCause() {
        return (QasmSyntaxException) super.getCause();
    }
}
