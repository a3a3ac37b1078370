package io.github.eutro.qasm2py.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * The value of a gate parameter: a number, or an expression over named circuit inputs.
 * <p>
 * Arithmetic on numbers folds to a number, so a parameter is only symbolic if it
 * depends on an input. Parameters are immutable and compared structurally.
 */
public abstract class Param {
    Param() {
    }

    /**
     * Get a numeric parameter.
     *
     * @param value The value.
     * @return The parameter.
     */
    @NotNull
    public static Param of(double value) {
        return new Number(value);
    }

    /**
     * Get a reference to a circuit input.
     *
     * @param name The name of the input.
     * @return The parameter.
     */
    @NotNull
    public static Param symbol(@NotNull String name) {
        return new Symbol(name);
    }

    /**
     * Get whether this parameter is a plain number.
     *
     * @return Whether {@link #getValue()} can be called.
     */
    public boolean isNumeric() {
        return false;
    }

    /**
     * Get the value of a numeric parameter.
     *
     * @return The value.
     * @throws IllegalStateException If the parameter is symbolic.
     */
    public double getValue() {
        throw new IllegalStateException(this + " is not a number");
    }

    /**
     * Get the names of the inputs this parameter depends on, in order of first appearance.
     *
     * @return The names.
     */
    @NotNull
    public Set<String> getSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        collectSymbols(symbols);
        return Collections.unmodifiableSet(symbols);
    }

    abstract void collectSymbols(Set<String> into);

    public abstract <R> R accept(@NotNull Visitor<R> visitor);

    public Param plus(@NotNull Param rhs) {
        return binary(Operator.ADD, this, rhs);
    }

    public Param minus(@NotNull Param rhs) {
        return binary(Operator.SUB, this, rhs);
    }

    public Param times(@NotNull Param rhs) {
        return binary(Operator.MUL, this, rhs);
    }

    public Param dividedBy(@NotNull Param rhs) {
        return binary(Operator.DIV, this, rhs);
    }

    public Param pow(@NotNull Param rhs) {
        return binary(Operator.POW, this, rhs);
    }

    public Param negate() {
        return isNumeric() ? of(-getValue()) : new Negation(this);
    }

    public Param apply(@NotNull Function fn) {
        return isNumeric() ? of(fn.applyAsDouble(getValue())) : new Call(fn, this);
    }

    private static Param binary(Operator op, Param lhs, Param rhs) {
        if (lhs.isNumeric() && rhs.isNumeric()) {
            return of(op.applyAsDouble(lhs.getValue(), rhs.getValue()));
        }
        return new Binary(op, lhs, rhs);
    }

    /**
     * A binary arithmetic operator.
     */
    public enum Operator implements DoubleBinaryOperator {
        ADD("+") {
            @Override
            public double applyAsDouble(double left, double right) {
                return left + right;
            }
        },
        SUB("-") {
            @Override
            public double applyAsDouble(double left, double right) {
                return left - right;
            }
        },
        MUL("*") {
            @Override
            public double applyAsDouble(double left, double right) {
                return left * right;
            }
        },
        DIV("/") {
            @Override
            public double applyAsDouble(double left, double right) {
                return left / right;
            }
        },
        POW("**") {
            @Override
            public double applyAsDouble(double left, double right) {
                return Math.pow(left, right);
            }
        },
        ;

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @NotNull
        public String getSymbol() {
            return symbol;
        }
    }

    /**
     * A unary function that may appear in parameter expressions.
     */
    public enum Function implements DoubleUnaryOperator {
        SIN("sin", Math::sin),
        COS("cos", Math::cos),
        TAN("tan", Math::tan),
        ARCSIN("arcsin", Math::asin),
        ARCCOS("arccos", Math::acos),
        ARCTAN("arctan", Math::atan),
        EXP("exp", Math::exp),
        LN("ln", Math::log),
        SQRT("sqrt", Math::sqrt),
        ;

        private final String name;
        private final DoubleUnaryOperator op;

        Function(String name, DoubleUnaryOperator op) {
            this.name = name;
            this.op = op;
        }

        /**
         * Get the name of this function in OpenQASM.
         *
         * @return The name.
         */
        @NotNull
        public String getName() {
            return name;
        }

        @Override
        public double applyAsDouble(double operand) {
            return op.applyAsDouble(operand);
        }
    }

    public interface Visitor<R> {
        R visitNumber(double value);

        R visitSymbol(@NotNull String name);

        R visitNegation(@NotNull Param operand);

        R visitBinary(@NotNull Operator op, @NotNull Param lhs, @NotNull Param rhs);

        R visitCall(@NotNull Function fn, @NotNull Param arg);
    }

    private static final class Number extends Param {
        private final double value;

        Number(double value) {
            this.value = value;
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double getValue() {
            return value;
        }

        @Override
        void collectSymbols(Set<String> into) {
        }

        @Override
        public <R> R accept(@NotNull Visitor<R> visitor) {
            return visitor.visitNumber(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Number && Double.compare(value, ((Number) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    private static final class Symbol extends Param {
        private final String name;

        Symbol(String name) {
            this.name = name;
        }

        @Override
        void collectSymbols(Set<String> into) {
            into.add(name);
        }

        @Override
        public <R> R accept(@NotNull Visitor<R> visitor) {
            return visitor.visitSymbol(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Symbol && name.equals(((Symbol) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class Negation extends Param {
        private final Param operand;

        Negation(Param operand) {
            this.operand = operand;
        }

        @Override
        void collectSymbols(Set<String> into) {
            operand.collectSymbols(into);
        }

        @Override
        public <R> R accept(@NotNull Visitor<R> visitor) {
            return visitor.visitNegation(operand);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Negation && operand.equals(((Negation) o).operand);
        }

        @Override
        public int hashCode() {
            return -operand.hashCode();
        }

        @Override
        public String toString() {
            return "-(" + operand + ")";
        }
    }

    private static final class Binary extends Param {
        private final Operator op;
        private final Param lhs;
        private final Param rhs;

        Binary(Operator op, Param lhs, Param rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        void collectSymbols(Set<String> into) {
            lhs.collectSymbols(into);
            rhs.collectSymbols(into);
        }

        @Override
        public <R> R accept(@NotNull Visitor<R> visitor) {
            return visitor.visitBinary(op, lhs, rhs);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary that = (Binary) o;
            return op == that.op && lhs.equals(that.lhs) && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, lhs, rhs);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.getSymbol() + " " + rhs + ")";
        }
    }

    private static final class Call extends Param {
        private final Function fn;
        private final Param arg;

        Call(Function fn, Param arg) {
            this.fn = fn;
            this.arg = arg;
        }

        @Override
        void collectSymbols(Set<String> into) {
            arg.collectSymbols(into);
        }

        @Override
        public <R> R accept(@NotNull Visitor<R> visitor) {
            return visitor.visitCall(fn, arg);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Call && fn == ((Call) o).fn && arg.equals(((Call) o).arg);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fn, arg);
        }

        @Override
        public String toString() {
            return fn.getName() + "(" + arg + ")";
        }
    }
}
