package io.github.eutro.decompir.api.events;

import io.github.eutro.decompir.core.ast.Function;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after definitions have been substituted into the body, before it is reduced.
 * <p>
 * Listeners may replace the body of the function; liveness is computed afterwards.
 */
public class SubstitutedEvent implements FunctionCompileEvent {
    @NotNull
    public Function function;

    public SubstitutedEvent(@NotNull Function function) {
        this.function = function;
    }
}
