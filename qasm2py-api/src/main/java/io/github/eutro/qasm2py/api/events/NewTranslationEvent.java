package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.api.Translation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when source is submitted to a translator, before the translation is run.
 */
public class NewTranslationEvent implements TranslatorEvent {
    @NotNull
    public Translation translation;

    public NewTranslationEvent(@NotNull Translation translation) {
        this.translation = translation;
    }
}
