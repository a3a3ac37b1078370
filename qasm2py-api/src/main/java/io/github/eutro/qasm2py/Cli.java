package io.github.eutro.qasm2py;

import io.github.eutro.qasm2py.api.QasmTranslator;
import io.github.eutro.qasm2py.api.Translation;
import io.github.eutro.qasm2py.api.bits.ProgramsToDirectory;
import io.github.eutro.qasm2py.api.events.EmitProgramEvent;
import io.github.eutro.qasm2py.core.parse.CircuitLoadException;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run the command line interface.
     *
     * @param args The arguments.
     * @param out  Where to print programs and help.
     * @param err  Where to print errors.
     * @return The exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        File outputDir = null;
        String varName = null;
        boolean includeImports = true;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            err.printf("%s: expected directory%n", arg);
                            return 1;
                        }
                        if (outputDir != null) {
                            err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        outputDir = new File(args[i++]);
                        break;
                    case "-n":
                    case "--name":
                        if (i == args.length) {
                            err.printf("%s: expected variable name%n", arg);
                            return 1;
                        }
                        varName = args[i++];
                        break;
                    case "--no-imports":
                        includeImports = false;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp(err);
            return 1;
        }

        QasmTranslator cc = new QasmTranslator();
        if (outputDir != null) {
            new ProgramsToDirectory<>(outputDir.toPath()).addTo(cc.lift());
        } else {
            cc.lift().listen(EmitProgramEvent.class, evt -> out.println(evt.program.text()));
        }
        for (String path : paths) {
            File file = new File(path);
            try {
                Translation translation = cc.submitFile(file.toPath());
                if (varName != null) translation.setVariableName(varName);
                translation.setIncludeImports(includeImports);
                translation.run();
            } catch (IOException | UncheckedIOException e) {
                err.printf("could not read or write file %s: %s%n", file, e);
                return 1;
            } catch (CircuitLoadException e) {
                err.printf("%s: %s%n", file, e.getMessage());
                return 1;
            } catch (IllegalArgumentException e) {
                err.printf("%s%n", e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private static void printHelp(PrintStream ps) {
        ps.println(
                "usage: qasm2py [-h|--help] [-o|--output <dir>] [-n|--name <var>] [--no-imports] [--] <file> ...\n" +
                        "\n" +
                        "  <file> : an OpenQASM 2 or OpenQASM 3 source file\n" +
                        "  -o|--output <dir> : write each program to <dir>/<file name without .qasm>.py,\n" +
                        "                      instead of printing it\n" +
                        "  -n|--name <var> : name the main circuit variable <var> (default qc)\n" +
                        "  --no-imports : leave out the qiskit import line\n" +
                        "  -h|--help : show this help"
        );
    }
}
