package io.github.eutro.decompir.api.events;

import io.github.eutro.decompir.api.Decompiler;
import io.github.eutro.decompir.api.FunctionCompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a function compilation is started.
 *
 * @see Decompiler
 * @see FunctionCompilation
 */
public class RunFunctionCompilationEvent implements DecompilerEvent {
    /**
     * The function compilation.
     */
    @NotNull
    public FunctionCompilation compilation;

    public RunFunctionCompilationEvent(@NotNull FunctionCompilation compilation) {
        this.compilation = compilation;
    }
}
