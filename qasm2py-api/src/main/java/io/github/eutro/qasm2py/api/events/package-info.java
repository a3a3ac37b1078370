/**
 * Events that occur during a translation.
 * <p>
 * These can be used to configure the translator, to inspect or replace
 * intermediate results, and to collect the output.
 * <p>
 * The API revolves around {@link io.github.eutro.qasm2py.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.qasm2py.api.events;
