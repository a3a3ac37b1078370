package io.github.eutro.qasm2py.core.parse;

/**
 * Thrown when source declares neither OpenQASM 2 nor OpenQASM 3.
 */
public class UnknownDialectException extends CircuitLoadException {
    public UnknownDialectException(String message) {
        super(message);
    }
}
