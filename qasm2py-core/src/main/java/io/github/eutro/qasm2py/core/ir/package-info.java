/**
 * The circuit intermediate representation.
 * <p>
 * A {@link io.github.eutro.qasm2py.core.ir.Circuit} owns its registers and its
 * {@link io.github.eutro.qasm2py.core.ir.Instruction instructions}. Instructions that
 * call composite gates own their expansion, itself a circuit with its own registers,
 * so a program forms a tree of circuits rooted at the main one.
 */
package io.github.eutro.qasm2py.core.ir;
