package io.github.eutro.decompir.api.events;

import io.github.eutro.decompir.core.ast.Function;
import org.jetbrains.annotations.NotNull;

/**
 * Fired with the final, reduced function.
 */
public class ReducedEvent implements FunctionCompileEvent {
    @NotNull
    public Function function;

    public ReducedEvent(@NotNull Function function) {
        this.function = function;
    }
}
