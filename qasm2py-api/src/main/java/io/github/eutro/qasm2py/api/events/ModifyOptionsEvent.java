package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.api.Translation;
import io.github.eutro.qasm2py.core.conf.TranslationOptions;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when constructing the {@link TranslationOptions options} of a translation.
 *
 * @see Translation
 * @see TranslationOptions.Builder
 */
public class ModifyOptionsEvent implements TranslationEvent {
    /**
     * The options builder.
     */
    @NotNull
    public TranslationOptions.Builder optionsBuilder;

    /**
     * Construct a new modify-options event with the given options builder.
     *
     * @param optionsBuilder The builder.
     */
    public ModifyOptionsEvent(@NotNull TranslationOptions.Builder optionsBuilder) {
        this.optionsBuilder = optionsBuilder;
    }
}
