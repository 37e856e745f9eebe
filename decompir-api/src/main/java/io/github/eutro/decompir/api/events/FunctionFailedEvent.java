package io.github.eutro.decompir.api.events;

import io.github.eutro.decompir.api.Decompiler;
import io.github.eutro.decompir.api.FunctionCompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when the compilation of a function throws. The other functions are still compiled.
 *
 * @see Decompiler#runAll(Iterable)
 */
public class FunctionFailedEvent implements DecompilerEvent {
    @NotNull
    public FunctionCompilation compilation;
    /**
     * What the compilation threw.
     */
    @NotNull
    public RuntimeException exception;

    public FunctionFailedEvent(@NotNull FunctionCompilation compilation, @NotNull RuntimeException exception) {
        this.compilation = compilation;
        this.exception = exception;
    }
}
