package io.github.eutro.qasm2py.api;

import io.github.eutro.qasm2py.api.bits.Bit;
import io.github.eutro.qasm2py.api.events.*;
import io.github.eutro.qasm2py.core.emit.EmittedProgram;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Translates OpenQASM sources to Python programs for Qiskit.
 * <p>
 * Submitting source creates a {@link Translation}, which does nothing until it is {@link Translation#run() run}.
 * Listeners added to the translator, directly or through {@link #lift()}, apply to every translation.
 */
public class QasmTranslator extends EventSupplier<TranslatorEvent> {
    /**
     * The file extension stripped from file names to name programs.
     */
    public static final String QASM_EXTENSION = ".qasm";

    @Contract(pure = true)
    public Translation submitText(@NotNull String source) {
        return newTranslation(source);
    }

    /**
     * Submit an OpenQASM file, read as UTF-8. The translation is named after the file,
     * without its {@value #QASM_EXTENSION} extension.
     *
     * @param path The file.
     * @return The translation.
     * @throws IOException If the file could not be read.
     */
    @Contract(pure = true)
    public Translation submitFile(@NotNull Path path) throws IOException {
        String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        String name = String.valueOf(path.getFileName());
        if (name.endsWith(QASM_EXTENSION)) {
            name = name.substring(0, name.length() - QASM_EXTENSION.length());
        }
        return newTranslation(source).setName(name);
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    private Translation newTranslation(String source) {
        Translation translation = new Translation(this, source);
        dispatch(NewTranslationEvent.class, new NewTranslationEvent(translation));
        return translation;
    }

    /**
     * Get a dispatcher on which listeners are added to every translation this translator runs.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<TranslationEvent> lift() {
        return new EventDispatcher<TranslationEvent>() {
            @Override
            public <T extends TranslationEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                QasmTranslator.this.listen(RunTranslationEvent.class, evt ->
                        evt.translation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect every program this translator emits into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<EmittedProgram> outputsAsQueue() {
        BlockingQueue<EmittedProgram> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitProgramEvent.class, evt -> queue.add(evt.program));
        return queue;
    }

    public <T> T add(Bit<? super QasmTranslator, T> bit) {
        return bit.addTo(this);
    }
}
