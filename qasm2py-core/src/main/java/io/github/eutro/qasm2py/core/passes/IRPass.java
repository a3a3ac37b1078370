package io.github.eutro.qasm2py.core.passes;

/**
 * A pass to run on some part of the IR, converting it to a different form:
 * source text to a {@link io.github.eutro.qasm2py.core.ir.Circuit Circuit}, a circuit
 * to its custom gates, or a circuit to a Python program.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     * <p>
     * Exceptions thrown by either pass propagate unchanged.
     *
     * @param next The pass to run after this.
     * @return The composed pass.
     * @param <C> The result type.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return a -> next.run(run(a));
    }
}
