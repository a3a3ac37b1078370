package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.core.emit.EmittedProgram;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Fired when a program should be emitted.
 *
 * @see io.github.eutro.qasm2py.api.Translation
 */
public class EmitProgramEvent extends CancellableEvent implements TranslationEvent {
    /**
     * The name of the program, if it has one.
     */
    @Nullable
    public String name;
    /**
     * The program to be emitted.
     */
    @NotNull
    public EmittedProgram program;

    /**
     * Construct a new program emit event.
     *
     * @param name    The name of the program.
     * @param program The program to emit.
     */
    public EmitProgramEvent(@Nullable String name, @NotNull EmittedProgram program) {
        this.name = name;
        this.program = program;
    }
}
