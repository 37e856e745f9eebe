package io.github.eutro.decompir;

import com.google.gson.JsonParseException;
import io.github.eutro.decompir.api.Decompiler;
import io.github.eutro.decompir.api.DecompilerConfig;
import io.github.eutro.decompir.api.FunctionCompilation;
import io.github.eutro.decompir.api.events.FunctionFailedEvent;
import io.github.eutro.decompir.api.events.ReducedEvent;
import io.github.eutro.decompir.api.serial.FunctionFile;
import io.github.eutro.decompir.core.ast.Function;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        List<String> paths = new ArrayList<>();
        File configFile = null;
        File outputDir = null;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp();
                        return 0;
                    case "-c":
                    case "--config":
                        if (i == args.length) {
                            System.err.printf("%s: expected file%n", arg);
                            return 1;
                        }
                        if (configFile != null) {
                            System.err.printf("%s: config already specified%n", arg);
                            return 1;
                        }
                        configFile = new File(args[i++]);
                        break;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            System.err.printf("%s: expected directory%n", arg);
                            return 1;
                        }
                        if (outputDir != null) {
                            System.err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        outputDir = new File(args[i++]);
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        System.err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp();
            return 1;
        }

        DecompilerConfig config = DecompilerConfig.DEFAULT;
        if (configFile != null) {
            try (Reader reader = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
                config = DecompilerConfig.read(reader);
            } catch (IOException | JsonParseException e) {
                System.err.printf("could not read config %s: %s%n", configFile, e);
                return 1;
            }
        }

        Decompiler dc = new Decompiler(config);
        dc.listen(FunctionFailedEvent.class, evt ->
                System.err.printf("%s: decompilation failed: %s%n", evt.compilation.function.name, evt.exception));
        Path outputPath = outputDir == null ? null : outputDir.toPath();
        dc.lift().listen(ReducedEvent.class, evt -> emit(evt.function, outputPath));

        boolean failed = false;
        List<FunctionCompilation> compilations = new ArrayList<>();
        for (String path : paths) {
            try {
                compilations.add(dc.submitFile(new File(path).toPath()));
            } catch (IOException e) {
                System.err.printf("could not read file %s: %s%n", path, e);
                failed = true;
            } catch (RuntimeException e) {
                System.err.printf("%s: malformed function: %s%n", path, e);
                failed = true;
            }
        }
        if (dc.runAll(compilations) > 0) failed = true;
        return failed ? 1 : 0;
    }

    private static void emit(Function func, Path outputDir) {
        if (outputDir == null) {
            System.out.println(func.toCLike());
            return;
        }
        try {
            Files.createDirectories(outputDir);
            Files.write(outputDir.resolve(func.name + ".c"),
                    (func.toCLike() + "\n").getBytes(StandardCharsets.UTF_8));
            try (Writer writer = Files.newBufferedWriter(outputDir.resolve(func.name + ".json"), StandardCharsets.UTF_8)) {
                FunctionFile.of(func).write(writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void printHelp() {
        System.out.println(
                "usage: decompir [-h|--help] [-c|--config <config.json>] [-o|--output <dir>] <function.json> ...\n" +
                        "\n" +
                        "  <function.json> : a function tree, as {\"name\", \"body\", \"nodes\"}\n" +
                        "  -c|--config <config.json> : calling convention, macro names and passes to run\n" +
                        "  -o|--output <dir> : write <dir>/<name>.c and <dir>/<name>.json instead of printing\n" +
                        "  -h|--help : show this help"
        );
    }
}
