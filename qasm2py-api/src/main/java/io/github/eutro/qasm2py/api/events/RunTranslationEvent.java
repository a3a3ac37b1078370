package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.api.QasmTranslator;
import io.github.eutro.qasm2py.api.Translation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a translation is started.
 *
 * @see QasmTranslator
 * @see Translation
 */
public class RunTranslationEvent implements TranslatorEvent {
    /**
     * The translation.
     */
    @NotNull
    public Translation translation;

    /**
     * Construct a new run-translation event.
     *
     * @param translation The translation.
     */
    public RunTranslationEvent(@NotNull Translation translation) {
        this.translation = translation;
    }
}
