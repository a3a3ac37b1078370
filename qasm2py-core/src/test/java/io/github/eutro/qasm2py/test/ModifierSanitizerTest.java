package io.github.eutro.qasm2py.test;

import io.github.eutro.qasm2py.core.parse.ModifierSanitizer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ModifierSanitizerTest {
    @Test
    void testStripsModifiers() {
        assertEquals("cx b,e;", ModifierSanitizer.sanitize("ctrl @ cx b,e;"));
        assertEquals("ccx a,b,c;", ModifierSanitizer.sanitize("ctrl(2) @ ccx a,b,c;"));
        assertEquals("x q[0];", ModifierSanitizer.sanitize("inv @ x q[0];"));
        assertEquals("rz(0.1) q[0];", ModifierSanitizer.sanitize("pow(3) @ rz(0.1) q[0];"));
    }

    @Test
    void testStripsChains() {
        assertEquals("x q[0];", ModifierSanitizer.sanitize("negctrl @ inv @ x q[0];"));
        assertEquals("h q[1];", ModifierSanitizer.sanitize("  pow( -2 ) @ negctrl( 1 )@ h q[1];"));
    }

    @Test
    void testLeavesOtherLines() {
        String src = "OPENQASM 3.0;\n"
                + "    h q[0];\n"
                + "\n"
                + "// ctrl @ x q[0];\n";
        assertEquals(src, ModifierSanitizer.sanitize(src));
        // lines mentioning @ anywhere lose their indentation
        assertEquals("x q[0]; // ctrl @ y", ModifierSanitizer.sanitize("  x q[0]; // ctrl @ y"));
    }

    @Test
    void testLineEndings() {
        assertEquals("h q;\nx q;", ModifierSanitizer.sanitize("inv @ h q;\r\nx q;"));
    }

    @Test
    void testIdempotent() {
        String src = "OPENQASM 3.0;\n"
                + "  ctrl @ inv @ x q[0], q[1];\n"
                + "pow(2) @ s q[0];\n"
                + "// inv @ t q[0];\n"
                + "h q[0];";
        String once = ModifierSanitizer.sanitize(src);
        assertEquals(once, ModifierSanitizer.sanitize(once));
        assertEquals("OPENQASM 3.0;\n"
                + "x q[0], q[1];\n"
                + "s q[0];\n"
                + "// inv @ t q[0];\n"
                + "h q[0];", once);
    }
}
