package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.api.Translation;

/**
 * An event fired during the translation of a single circuit.
 *
 * @see Translation
 */
public interface TranslationEvent {
}
