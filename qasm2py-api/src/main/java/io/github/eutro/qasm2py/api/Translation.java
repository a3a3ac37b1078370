package io.github.eutro.qasm2py.api;

import io.github.eutro.qasm2py.api.events.*;
import io.github.eutro.qasm2py.core.conf.TranslationOptions;
import io.github.eutro.qasm2py.core.emit.CustomGateTable;
import io.github.eutro.qasm2py.core.emit.EmittedProgram;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.parse.CircuitLoader;
import io.github.eutro.qasm2py.core.passes.AssembleProgram;
import io.github.eutro.qasm2py.core.passes.CollectCustomGates;
import org.jetbrains.annotations.NotNull;

import java.util.logging.Logger;

/**
 * Represents the translation of a single OpenQASM source.
 * <p>
 * Translation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunTranslationEvent} is fired on the {@link QasmTranslator translator}.</li>
 *     <li>{@link ModifyOptionsEvent} is fired.</li>
 *     <li>The source is {@link CircuitLoader loaded} into a circuit.</li>
 *     <li>{@link ReceiveCircuitEvent} is fired.</li>
 *     <li>The {@link CollectCustomGates custom gates} of the circuit are collected.</li>
 *     <li>{@link CustomGatesEvent} is fired.</li>
 *     <li>The Python program is {@link AssembleProgram assembled}.</li>
 *     <li>{@link EmitProgramEvent} is fired.</li>
 * </ol>
 */
public class Translation extends EventSupplier<TranslationEvent> {
    private static final Logger LOG = Logger.getLogger(Translation.class.getName());

    private final QasmTranslator cc;
    private boolean ran = false;

    /**
     * The OpenQASM source being translated.
     */
    @NotNull
    public final String source;

    Translation(QasmTranslator cc, @NotNull String source) {
        this.cc = cc;
        this.source = source;
    }

    /**
     * Run the translation.
     * <p>
     * See the documentation of this class for details.
     *
     * @throws IllegalStateException If this translation has already been run.
     * @throws io.github.eutro.qasm2py.core.parse.CircuitLoadException If the source could not be loaded.
     */
    public void run() {
        if (ran) {
            throw new IllegalStateException("translation has already been run");
        }
        ran = true;
        cc.dispatch(RunTranslationEvent.class, new RunTranslationEvent(this));
        TranslationOptions options = dispatch(ModifyOptionsEvent.class,
                new ModifyOptionsEvent(TranslationOptions.builder()))
                .optionsBuilder
                .build();
        LOG.fine(() -> "translating with " + options);

        Circuit circuit = CircuitLoader.INSTANCE.run(source);
        circuit = dispatch(ReceiveCircuitEvent.class, new ReceiveCircuitEvent(circuit)).circuit;

        CustomGateTable customGates = CollectCustomGates.INSTANCE.run(circuit);
        customGates = dispatch(CustomGatesEvent.class, new CustomGatesEvent(circuit, customGates)).customGates;

        EmittedProgram program = new AssembleProgram(options).assemble(circuit, customGates);
        dispatch(EmitProgramEvent.class, new EmitProgramEvent(options.getProgramName(), program));
    }

    /**
     * Set the name of the program produced by this translation, by
     * {@link ModifyOptionsEvent modifying the options}.
     *
     * @param name The name.
     * @return This, for convenience.
     * @see TranslationOptions.Builder#setProgramName(String)
     */
    public Translation setName(String name) {
        listen(ModifyOptionsEvent.class, evt -> evt.optionsBuilder.setProgramName(name));
        return this;
    }

    /**
     * Set the name of the main circuit variable.
     *
     * @param variableName The name.
     * @return This, for convenience.
     * @see TranslationOptions.Builder#setVariableName(String)
     */
    public Translation setVariableName(String variableName) {
        listen(ModifyOptionsEvent.class, evt -> evt.optionsBuilder.setVariableName(variableName));
        return this;
    }

    /**
     * Set whether the program starts with the import line.
     *
     * @param includeImports Whether to include imports.
     * @return This, for convenience.
     * @see TranslationOptions.Builder#setIncludeImports(boolean)
     */
    public Translation setIncludeImports(boolean includeImports) {
        listen(ModifyOptionsEvent.class, evt -> evt.optionsBuilder.setIncludeImports(includeImports));
        return this;
    }
}
