package io.github.eutro.qasm2py.core.emit;

import io.github.eutro.qasm2py.core.ir.Param;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Renders values as Python source literals, the way Python's {@code repr} would, and gate
 * parameters as Python expressions.
 */
public final class PythonLiterals {
    private PythonLiterals() {
    }

    /**
     * Render a float the way Python's {@code repr(float)} does: the shortest digit string
     * that reads back as the same double, in positional notation if the decimal exponent
     * is in {@code [-4, 16)}, and in scientific notation otherwise.
     * <p>
     * Non-finite values render as {@code inf}, {@code -inf} and {@code nan}, which are
     * not Python literals but are what {@code repr} produces.
     *
     * @param d The value.
     * @return The literal.
     */
    @NotNull
    public static String repr(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0) return (1 / d < 0) ? "-0.0" : "0.0";

        BigDecimal exact = new BigDecimal(d);
        BigDecimal shortest = exact;
        for (int precision = 1; precision <= 17; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == d) {
                shortest = rounded;
                break;
            }
        }
        shortest = shortest.stripTrailingZeros();
        int exponent = shortest.precision() - shortest.scale() - 1;

        if (exponent >= -4 && exponent < 16) {
            String plain = shortest.toPlainString();
            return plain.indexOf('.') == -1 ? plain + ".0" : plain;
        }
        String digits = shortest.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder();
        if (shortest.signum() < 0) sb.append('-');
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int absExp = Math.abs(exponent);
        if (absExp < 10) sb.append('0');
        sb.append(absExp);
        return sb.toString();
    }

    /**
     * Render a string the way Python's {@code repr(str)} does, in single quotes unless
     * the string contains single quotes and no double quotes.
     *
     * @param s The string.
     * @return The literal.
     */
    @NotNull
    public static String repr(@NotNull String s) {
        char quote = s.indexOf('\'') != -1 && s.indexOf('"') == -1 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(s.length() + 2).append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                // @formatter:off
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                // @formatter:on
                default:
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Render integers as a Python list, e.g. {@code [0, 1, 2]}.
     *
     * @param values The integers.
     * @return The list literal.
     */
    @NotNull
    public static String list(int @NotNull [] values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i != 0) sb.append(", ");
            sb.append(values[i]);
        }
        return sb.append(']').toString();
    }

    /**
     * Render a gate parameter: a float literal if it is a number, otherwise a Python
     * expression over Qiskit {@code Parameter} variables named after the circuit inputs.
     * <p>
     * Compound operands are always parenthesised, and functions are written as the
     * {@code ParameterExpression} methods, e.g. {@code (theta * 2.0).sin()}.
     *
     * @param param The parameter.
     * @return The expression.
     */
    @NotNull
    public static String repr(@NotNull Param param) {
        return param.accept(RENDER);
    }

    private static final Param.Visitor<String> RENDER = new Param.Visitor<String>() {
        @Override
        public String visitNumber(double value) {
            return repr(value);
        }

        @Override
        public String visitSymbol(@NotNull String name) {
            return name;
        }

        @Override
        public String visitNegation(@NotNull Param operand) {
            return "-" + operand(operand);
        }

        @Override
        public String visitBinary(@NotNull Param.Operator op, @NotNull Param lhs, @NotNull Param rhs) {
            return operand(lhs) + " " + op.getSymbol() + " " + operand(rhs);
        }

        @Override
        public String visitCall(@NotNull Param.Function fn, @NotNull Param arg) {
            switch (fn) {
                case SQRT:
                    return operand(arg) + " ** 0.5";
                case LN:
                    return operand(arg) + ".log()";
                default:
                    return operand(arg) + "." + fn.getName() + "()";
            }
        }
    };

    private static final Param.Visitor<Boolean> ATOMIC = new Param.Visitor<Boolean>() {
        @Override
        public Boolean visitNumber(double value) {
            return Double.isFinite(value) && Double.compare(value, 0.0) >= 0;
        }

        @Override
        public Boolean visitSymbol(@NotNull String name) {
            return true;
        }

        @Override
        public Boolean visitNegation(@NotNull Param operand) {
            return false;
        }

        @Override
        public Boolean visitBinary(@NotNull Param.Operator op, @NotNull Param lhs, @NotNull Param rhs) {
            return false;
        }

        @Override
        public Boolean visitCall(@NotNull Param.Function fn, @NotNull Param arg) {
            return fn != Param.Function.SQRT;
        }
    };

    private static String operand(Param param) {
        String rendered = repr(param);
        return param.accept(ATOMIC) ? rendered : "(" + rendered + ")";
    }

    /**
     * Render parameters as a Python list, e.g. {@code [0.5, 1e-05]}.
     *
     * @param values The parameters.
     * @return The list literal.
     */
    @NotNull
    public static String list(@NotNull List<Param> values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(repr(values.get(i)));
        }
        return sb.append(']').toString();
    }
}
