package io.github.eutro.qasm2py.core.emit;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The lines of a generated Python program.
 */
public final class EmittedProgram {
    private final List<String> lines;

    public EmittedProgram(@NotNull List<String> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    @NotNull
    public List<String> getLines() {
        return lines;
    }

    /**
     * Get the program text, the lines joined with {@code \n}. There is no trailing newline.
     *
     * @return The text.
     */
    @NotNull
    public String text() {
        return String.join("\n", lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return lines.equals(((EmittedProgram) o).lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return text();
    }
}
