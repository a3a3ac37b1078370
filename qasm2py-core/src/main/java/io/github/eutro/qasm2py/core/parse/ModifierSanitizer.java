package io.github.eutro.qasm2py.core.parse;

import org.jetbrains.annotations.NotNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips OpenQASM 3 gate modifiers from source text, so that it can be parsed by a loader
 * that does not understand them.
 * <p>
 * This is lossy: {@code ctrl @ x a, b;} becomes {@code x a, b;}, which is a different
 * (and likely ill-formed) operation. It is only used as a last resort when parsing the
 * original text fails.
 */
public final class ModifierSanitizer {
    private ModifierSanitizer() {
    }

    private static final Pattern MODIFIER = Pattern.compile(
            "^(?:ctrl(?:\\(\\s*\\d+\\s*\\))?"
                    + "|negctrl(?:\\(\\s*\\d+\\s*\\))?"
                    + "|inv"
                    + "|pow\\(\\s*[-+]?\\d+\\s*\\))"
                    + "\\s*@\\s*");

    /**
     * Remove leading gate modifier chains from every line of some source.
     * <p>
     * Blank lines, {@code //} comment lines and lines without {@code @} are kept as-is.
     * Other lines are trimmed, then stripped of modifiers until none remain at the start.
     * Lines are joined with {@code \n}.
     *
     * @param source The source text.
     * @return The sanitized text.
     */
    @NotNull
    public static String sanitize(@NotNull String source) {
        String[] lines = source.split("\r?\n", -1);
        StringBuilder sb = new StringBuilder(source.length());
        for (int i = 0; i < lines.length; i++) {
            if (i != 0) sb.append('\n');
            sb.append(sanitizeLine(lines[i]));
        }
        return sb.toString();
    }

    private static String sanitizeLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("//") || line.indexOf('@') == -1) {
            return line;
        }
        Matcher matcher = MODIFIER.matcher(trimmed);
        while (matcher.lookingAt()) {
            trimmed = trimmed.substring(matcher.end());
            matcher = MODIFIER.matcher(trimmed);
        }
        return trimmed;
    }
}
