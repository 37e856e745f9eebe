package io.github.eutro.decompir.api;

import io.github.eutro.decompir.api.events.*;
import io.github.eutro.decompir.api.serial.FunctionFile;
import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.types.TypeLattice;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Creates {@link FunctionCompilation}s, and runs them with failures isolated per function.
 */
public class Decompiler extends EventSupplier<DecompilerEvent> {
    private final DecompilerConfig config;
    private final TypeLattice lattice;

    public Decompiler(DecompilerConfig config, TypeLattice lattice) {
        this.config = config;
        this.lattice = lattice;
    }

    public Decompiler(DecompilerConfig config) {
        this(config, TypeLattice.FLAT);
    }

    public Decompiler() {
        this(DecompilerConfig.DEFAULT);
    }

    public DecompilerConfig getConfig() {
        return config;
    }

    @Contract(pure = true)
    public FunctionCompilation submit(Function function) {
        return new FunctionCompilation(this, function);
    }

    @Contract(pure = true)
    public FunctionCompilation submit(FunctionFile file) {
        return submit(file.toFunction(config.callingConvention, lattice));
    }

    /**
     * Read a function file and submit it.
     *
     * @param path The path of the file.
     * @return The compilation.
     * @throws IOException If the file could not be read.
     */
    public FunctionCompilation submitFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return submit(FunctionFile.read(reader));
        }
    }

    /**
     * Run compilations in order. A compilation that throws is reported through a
     * {@link FunctionFailedEvent}, and the rest are still run.
     *
     * @param compilations The compilations.
     * @return The number of compilations that failed.
     */
    public int runAll(Iterable<FunctionCompilation> compilations) {
        int failed = 0;
        for (FunctionCompilation compilation : compilations) {
            try {
                compilation.run();
            } catch (RuntimeException e) {
                failed++;
                dispatch(FunctionFailedEvent.class, new FunctionFailedEvent(compilation, e));
            }
        }
        return failed;
    }

    /**
     * Get a dispatcher that listens to events on every compilation this decompiler runs.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<FunctionCompileEvent> lift() {
        return new EventDispatcher<FunctionCompileEvent>() {
            @Override
            public <T extends FunctionCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                Decompiler.this.listen(RunFunctionCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }
}
