package io.github.eutro.qasm2py.api.bits;

import io.github.eutro.qasm2py.api.events.EmitProgramEvent;
import io.github.eutro.qasm2py.api.events.EventDispatcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A bit which writes emitted programs to {@code <name>.py} in the given directory.
 * <p>
 * Programs without a name are written to {@value #DEFAULT_NAME}{@code .py}.
 *
 * @param <T> The type on which this listens to events.
 */
public class ProgramsToDirectory<T extends EventDispatcher<? super EmitProgramEvent>>
        implements Bit<T, Void> {
    public static final String DEFAULT_NAME = "circuit";

    private final Path directory;

    /**
     * Construct a {@link ProgramsToDirectory} for outputting to the given directory.
     *
     * @param directory The directory to write Python files to.
     */
    public ProgramsToDirectory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Void addTo(T cc) {
        cc.listen(EmitProgramEvent.class, evt -> {
            String name = evt.name == null ? DEFAULT_NAME : evt.name;
            try {
                Files.createDirectories(directory);
                Path file = directory.resolve(name + ".py");
                Files.write(file, (evt.program.text() + "\n").getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return null;
    }
}
