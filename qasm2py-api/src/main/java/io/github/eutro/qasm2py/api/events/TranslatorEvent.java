package io.github.eutro.qasm2py.api.events;

import io.github.eutro.qasm2py.api.QasmTranslator;

/**
 * An event fired on a translator.
 *
 * @see QasmTranslator
 */
public interface TranslatorEvent {
}
