package io.github.eutro.qasm2py.core.gates;

import io.github.eutro.qasm2py.core.ir.ControlInfo;
import io.github.eutro.qasm2py.core.ir.Param;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Facts about the gates Qiskit provides out of the box.
 */
public final class StandardGates {
    private StandardGates() {
    }

    /**
     * The gates considered built into the target API.
     * <p>
     * These are never turned into generated builder functions, even when the
     * instruction calling them has a definition.
     */
    public static final Set<String> PRIMITIVE_GATES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "id", "i", "x", "y", "z", "h", "s", "sdg", "t", "tdg", "sx", "sxdg",
            "rx", "ry", "rz", "p", "u", "u1", "u2", "u3",
            "cx", "cy", "cz", "swap", "cp",
            "crx", "cry", "crz", "cu",
            "ccx", "cswap", "mcx",
            "rzz"
    )));

    private static final Map<String, String> CANONICAL_NAMES = new HashMap<>();
    private static final Map<String, ControlInfo> CONTROLS = new HashMap<>();
    private static final Map<ControlInfo, String> CONTROLLED_NAMES = new HashMap<>();
    private static final Map<String, String> INVERSES = new HashMap<>();
    // gates whose powers scale every angle: g(a)^k = g(k * a)
    private static final Set<String> ROTATIONS = new HashSet<>(Arrays.asList(
            "rx", "ry", "rz", "p", "u1", "crx", "cry", "crz", "cp", "cu1", "rxx", "rzz", "global_phase"));
    // gates inverted by (θ, φ, λ[, γ]) -> (-θ, -λ, -φ[, -γ])
    private static final Set<String> EULER = new HashSet<>(Arrays.asList("u", "u3", "cu3", "cu"));

    static {
        CANONICAL_NAMES.put("U", "u");
        CANONICAL_NAMES.put("CX", "cx");
        CANONICAL_NAMES.put("phase", "p");
        CANONICAL_NAMES.put("cphase", "cp");
        CANONICAL_NAMES.put("gphase", "global_phase");

        control("cx", 1, "x");
        control("ccx", 2, "x");
        control("c3x", 3, "x");
        control("c4x", 4, "x");
        control("cy", 1, "y");
        control("cz", 1, "z");
        control("ch", 1, "h");
        control("csx", 1, "sx");
        control("c3sqrtx", 3, "sx");
        control("cswap", 1, "swap");
        control("crx", 1, "rx");
        control("cry", 1, "ry");
        control("crz", 1, "rz");
        control("cp", 1, "p");
        control("cu1", 1, "u1");
        control("cu3", 1, "u3");
        control("cu", 1, "u");

        for (String self : Arrays.asList("id", "x", "y", "z", "h", "cx", "cy", "cz", "ch",
                "swap", "ccx", "cswap", "c3x", "c4x")) {
            INVERSES.put(self, self);
        }
        for (String rotation : ROTATIONS) INVERSES.put(rotation, rotation);
        for (String euler : EULER) INVERSES.put(euler, euler);
        inversePair("s", "sdg");
        inversePair("t", "tdg");
        inversePair("sx", "sxdg");
    }

    private static void control(String name, int numControls, String base) {
        ControlInfo info = new ControlInfo(numControls, base);
        CONTROLS.put(name, info);
        CONTROLLED_NAMES.putIfAbsent(info, name);
    }

    private static void inversePair(String gate, String inverse) {
        INVERSES.put(gate, inverse);
        INVERSES.put(inverse, gate);
    }

    /**
     * Get whether a gate name is primitive.
     *
     * @param name The gate name.
     * @return Whether it is in {@link #PRIMITIVE_GATES}.
     */
    public static boolean isPrimitive(@NotNull String name) {
        return PRIMITIVE_GATES.contains(name);
    }

    /**
     * Get the name Qiskit gives a gate of the standard libraries, which differs for a few
     * aliases and built-ins (e.g. {@code phase} is {@code p}, {@code CX} is {@code cx}).
     *
     * @param sourceName The name in the OpenQASM source.
     * @return The canonical name.
     */
    @NotNull
    public static String canonicalName(@NotNull String sourceName) {
        return CANONICAL_NAMES.getOrDefault(sourceName, sourceName);
    }

    /**
     * Get the control information of a standard library gate.
     *
     * @param canonicalName The canonical name of the gate.
     * @return The control information, or null if the standard gate is not a controlled gate.
     */
    @Nullable
    public static ControlInfo controlInfo(@NotNull String canonicalName) {
        return CONTROLS.get(canonicalName);
    }

    /**
     * Get the name Qiskit gives a controlled gate: the standard gate's name where one
     * exists, {@code c<n><base>} otherwise, suffixed with {@code _o<state>} if some
     * controls are negated.
     *
     * @param info The control information.
     * @return The name.
     */
    @NotNull
    public static String controlledName(@NotNull ControlInfo info) {
        ControlInfo closed = new ControlInfo(info.getNumControlQubits(), info.getBaseGateName());
        String name = CONTROLLED_NAMES.get(closed);
        if (name == null) {
            if ("x".equals(info.getBaseGateName())) {
                name = "mcx";
            } else {
                int n = info.getNumControlQubits();
                name = "c" + (n == 1 ? "" : Integer.toString(n)) + info.getBaseGateName();
            }
        }
        return info.hasOpenControls() ? name + "_o" + info.getCtrlState() : name;
    }

    /**
     * Get whether raising a standard gate to a power multiplies all of its parameters.
     *
     * @param canonicalName The canonical name of the gate.
     * @return Whether the gate is a rotation.
     */
    public static boolean isRotation(@NotNull String canonicalName) {
        return ROTATIONS.contains(canonicalName);
    }

    /**
     * Get the canonical name of the inverse of a standard gate.
     *
     * @param canonicalName The canonical name of the gate.
     * @return The name of its inverse, which is the gate itself for gates inverted by
     * {@link #inverseParams(String, List) negating parameters}, or null if it is unknown.
     */
    @Nullable
    public static String inverseName(@NotNull String canonicalName) {
        return INVERSES.get(canonicalName);
    }

    /**
     * Get the parameters of the inverse of a standard gate.
     *
     * @param canonicalName The canonical name of the gate.
     * @param params        The parameters of the gate.
     * @return The parameters to call {@link #inverseName(String) its inverse} with.
     */
    @NotNull
    public static List<Param> inverseParams(@NotNull String canonicalName, @NotNull List<Param> params) {
        if (ROTATIONS.contains(canonicalName)) {
            List<Param> negated = new ArrayList<>(params.size());
            for (Param param : params) negated.add(param.negate());
            return negated;
        }
        if (EULER.contains(canonicalName) && params.size() >= 3) {
            List<Param> inverted = new ArrayList<>(params.size());
            inverted.add(params.get(0).negate());
            inverted.add(params.get(2).negate());
            inverted.add(params.get(1).negate());
            for (Param param : params.subList(3, params.size())) inverted.add(param.negate());
            return inverted;
        }
        return params;
    }
}
