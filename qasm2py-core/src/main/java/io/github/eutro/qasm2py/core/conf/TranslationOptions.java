package io.github.eutro.qasm2py.core.conf;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options controlling the Python program generated for a circuit.
 * <p>
 * Create with {@link #builder()}, or {@link #DEFAULT}.
 */
public final class TranslationOptions {
    /**
     * The default options: variable {@code qc}, with the import line, unnamed.
     */
    public static final TranslationOptions DEFAULT = builder().build();

    @NotNull
    private final String variableName;
    private final boolean includeImports;
    @Nullable
    private final String programName;

    private TranslationOptions(@NotNull String variableName, boolean includeImports, @Nullable String programName) {
        this.variableName = variableName;
        this.includeImports = includeImports;
        this.programName = programName;
    }

    /**
     * Get the name of the variable the main circuit is assigned to.
     *
     * @return The variable name.
     */
    @NotNull
    public String getVariableName() {
        return variableName;
    }

    /**
     * Get whether the program starts with {@code from qiskit import QuantumCircuit}.
     *
     * @return Whether to include imports.
     */
    public boolean isIncludeImports() {
        return includeImports;
    }

    /**
     * Get the name of the program, used for naming output files.
     *
     * @return The name, or null if it has none.
     */
    @Nullable
    public String getProgramName() {
        return programName;
    }

    /**
     * Create a builder initialised with these options.
     *
     * @return The builder.
     */
    @Contract(" -> new")
    public Builder toBuilder() {
        return new Builder()
                .setVariableName(variableName)
                .setIncludeImports(includeImports)
                .setProgramName(programName);
    }

    /**
     * Create a builder initialised with the default options.
     *
     * @return The builder.
     */
    @Contract(" -> new")
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TranslationOptions{variableName=" + variableName
                + ", includeImports=" + includeImports
                + ", programName=" + programName + "}";
    }

    /**
     * A builder for {@link TranslationOptions}.
     */
    public static final class Builder {
        private String variableName = "qc";
        private boolean includeImports = true;
        private String programName = null;

        private Builder() {
        }

        /**
         * Set the name of the main circuit variable.
         *
         * @param variableName The name, a Python identifier.
         * @return This.
         * @throws IllegalArgumentException If the name is not an identifier.
         */
        @Contract("_ -> this")
        public Builder setVariableName(@NotNull String variableName) {
            if (!isIdentifier(variableName)) {
                throw new IllegalArgumentException("not a valid variable name: " + variableName);
            }
            this.variableName = variableName;
            return this;
        }

        @Contract("_ -> this")
        public Builder setIncludeImports(boolean includeImports) {
            this.includeImports = includeImports;
            return this;
        }

        @Contract("_ -> this")
        public Builder setProgramName(@Nullable String programName) {
            this.programName = programName;
            return this;
        }

        public String getVariableName() {
            return variableName;
        }

        public boolean isIncludeImports() {
            return includeImports;
        }

        public String getProgramName() {
            return programName;
        }

        /**
         * Build the options.
         *
         * @return The options.
         */
        public TranslationOptions build() {
            return new TranslationOptions(variableName, includeImports, programName);
        }

        private static boolean isIdentifier(String name) {
            if (name.isEmpty()) return false;
            int first = name.codePointAt(0);
            if (first != '_' && !Character.isLetter(first)) return false;
            return name.codePoints().allMatch(c -> c == '_' || Character.isLetterOrDigit(c));
        }
    }
}
