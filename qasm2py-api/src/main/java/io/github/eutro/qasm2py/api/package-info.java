/**
 * A configurable API over the lower-level core qasm2py API.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.qasm2py.api.QasmTranslator},
 * to which OpenQASM sources can be submitted for translation.
 * <p>
 * The translator can be configured using the {@link io.github.eutro.qasm2py.api.events
 * events API}.
 */
package io.github.eutro.qasm2py.api;
