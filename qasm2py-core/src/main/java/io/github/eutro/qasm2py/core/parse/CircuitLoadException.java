package io.github.eutro.qasm2py.core.parse;

/**
 * Thrown when OpenQASM source cannot be loaded into a circuit.
 */
public class CircuitLoadException extends RuntimeException {
    public CircuitLoadException(String message) {
        super(message);
    }

    public CircuitLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
