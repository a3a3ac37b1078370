package io.github.eutro.qasm2py.core.gates;

import io.github.eutro.qasm2py.core.ir.Param;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A classical parameter expression, with gate parameters already resolved to positions.
 */
@FunctionalInterface
public interface Expr {
    /**
     * Evaluate the expression.
     *
     * @param params The values of the enclosing gate's parameters, by position.
     *               Empty outside of gate bodies.
     * @return The value.
     */
    @NotNull
    Param evaluate(@NotNull List<Param> params);

    static Expr constant(@NotNull Param value) {
        return $ -> value;
    }

    static Expr constant(double value) {
        return constant(Param.of(value));
    }

    static Expr param(int index) {
        return params -> params.get(index);
    }
}
