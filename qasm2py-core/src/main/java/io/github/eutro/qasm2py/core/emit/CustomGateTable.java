package io.github.eutro.qasm2py.core.emit;

import io.github.eutro.qasm2py.core.ir.Circuit;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The custom gates of a program, by name, in the order they were discovered.
 * Each name maps to the first definition found for it.
 */
public final class CustomGateTable implements Iterable<Map.Entry<String, Circuit>> {
    private final Map<String, Circuit> gates = new LinkedHashMap<>();

    /**
     * Add a gate, if no gate of that name is known yet.
     *
     * @param name       The gate name.
     * @param definition The gate definition.
     * @return Whether the gate was added.
     */
    public boolean add(@NotNull String name, @NotNull Circuit definition) {
        return gates.putIfAbsent(name, definition) == null;
    }

    public boolean contains(@NotNull String name) {
        return gates.containsKey(name);
    }

    @Nullable
    public Circuit get(@NotNull String name) {
        return gates.get(name);
    }

    /**
     * Get the gate names, in discovery order.
     *
     * @return The names.
     */
    @NotNull
    public Set<String> names() {
        return Collections.unmodifiableSet(gates.keySet());
    }

    public int size() {
        return gates.size();
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }

    @NotNull
    @Override
    public Iterator<Map.Entry<String, Circuit>> iterator() {
        return Collections.unmodifiableMap(gates).entrySet().iterator();
    }

    @Override
    public String toString() {
        return "CustomGateTable" + gates.keySet();
    }
}
