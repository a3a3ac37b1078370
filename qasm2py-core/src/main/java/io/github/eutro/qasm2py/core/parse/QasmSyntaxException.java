package io.github.eutro.qasm2py.core.parse;

/**
 * Thrown when OpenQASM source cannot be parsed.
 */
public class QasmSyntaxException extends RuntimeException {
    private final int line;
    private final int column;

    /**
     * Construct a syntax error at a source position.
     *
     * @param line    The 1-based line.
     * @param column  The 1-based column.
     * @param message The description of the error.
     */
    public QasmSyntaxException(int line, int column, String message) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
