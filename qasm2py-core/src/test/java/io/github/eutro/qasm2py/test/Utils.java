package io.github.eutro.qasm2py.test;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

public class Utils {
    @NotNull
    public static String getSource(String name) throws IOException {
        try (InputStream stream = Utils.class.getResourceAsStream(name)) {
            if (stream == null) throw new IOException("missing test resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @NotNull
    public static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
