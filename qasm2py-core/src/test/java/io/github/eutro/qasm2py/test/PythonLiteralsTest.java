package io.github.eutro.qasm2py.test;

import io.github.eutro.qasm2py.core.emit.PythonLiterals;
import io.github.eutro.qasm2py.core.ir.Param;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PythonLiteralsTest {
    @Test
    void testFloatRepr() {
        assertEquals("1.0", PythonLiterals.repr(1.0));
        assertEquals("0.1", PythonLiterals.repr(0.1));
        assertEquals("-2.5", PythonLiterals.repr(-2.5));
        assertEquals("123.456", PythonLiterals.repr(123.456));
        assertEquals("0.30000000000000004", PythonLiterals.repr(0.1 + 0.2));
        assertEquals("1.5707963267948966", PythonLiterals.repr(Math.PI / 2));
        assertEquals("3.141592653589793", PythonLiterals.repr(Math.PI));
    }

    @Test
    void testFloatReprNotation() {
        assertEquals("0.0001", PythonLiterals.repr(1e-4));
        assertEquals("1e-05", PythonLiterals.repr(1e-5));
        assertEquals("1000000000000000.0", PythonLiterals.repr(1e15));
        assertEquals("1e+16", PythonLiterals.repr(1e16));
        assertEquals("1.5e+300", PythonLiterals.repr(1.5e300));
        assertEquals("-2.5e-10", PythonLiterals.repr(-2.5e-10));
        assertEquals("5e-324", PythonLiterals.repr(Double.MIN_VALUE));
    }

    @Test
    void testFloatReprSpecial() {
        assertEquals("0.0", PythonLiterals.repr(0.0));
        assertEquals("-0.0", PythonLiterals.repr(-0.0));
        assertEquals("inf", PythonLiterals.repr(Double.POSITIVE_INFINITY));
        assertEquals("-inf", PythonLiterals.repr(Double.NEGATIVE_INFINITY));
        assertEquals("nan", PythonLiterals.repr(Double.NaN));
    }

    @Test
    void testStringRepr() {
        assertEquals("'outer'", PythonLiterals.repr("outer"));
        assertEquals("\"it's\"", PythonLiterals.repr("it's"));
        assertEquals("'say \"it\\'s\"'", PythonLiterals.repr("say \"it's\""));
        assertEquals("'a\\\\b\\n'", PythonLiterals.repr("a\\b\n"));
    }

    @Test
    void testLists() {
        assertEquals("[]", PythonLiterals.list(new int[0]));
        assertEquals("[0, 1, 2]", PythonLiterals.list(new int[]{0, 1, 2}));
        assertEquals("[0.5, 1e-05]", PythonLiterals.list(Arrays.asList(Param.of(0.5), Param.of(1e-5))));
        assertEquals("[theta, -0.5]", PythonLiterals.list(Arrays.asList(Param.symbol("theta"), Param.of(-0.5))));
    }

    @Test
    void testParamExpressions() {
        Param a = Param.symbol("a");
        Param b = Param.symbol("b");
        assertEquals("0.25", PythonLiterals.repr(Param.of(0.25)));
        assertEquals("a", PythonLiterals.repr(a));
        assertEquals("-a", PythonLiterals.repr(a.negate()));
        assertEquals("a + b", PythonLiterals.repr(a.plus(b)));
        assertEquals("(a - b) * 2.0", PythonLiterals.repr(a.minus(b).times(Param.of(2))));
        assertEquals("a * (-2.0)", PythonLiterals.repr(a.times(Param.of(-2))));
        assertEquals("a ** (b ** 2.0)", PythonLiterals.repr(a.pow(b.pow(Param.of(2)))));
        assertEquals("-(a / b)", PythonLiterals.repr(a.dividedBy(b).negate()));
        assertEquals("(a * 2.0).sin()", PythonLiterals.repr(a.times(Param.of(2)).apply(Param.Function.SIN)));
        assertEquals("a.arccos()", PythonLiterals.repr(a.apply(Param.Function.ARCCOS)));
        assertEquals("a.log()", PythonLiterals.repr(a.apply(Param.Function.LN)));
        assertEquals("(a + 1.0) ** 0.5", PythonLiterals.repr(a.plus(Param.of(1)).apply(Param.Function.SQRT)));
        assertEquals("(a ** 0.5).exp()", PythonLiterals.repr(a.apply(Param.Function.SQRT).apply(Param.Function.EXP)));
        // numbers fold before they are rendered
        assertEquals("1.0", PythonLiterals.repr(Param.of(4).apply(Param.Function.SQRT).minus(Param.of(1))));
    }
}
