package io.github.eutro.decompir.api;

import io.github.eutro.decompir.api.events.EventSupplier;
import io.github.eutro.decompir.api.events.FunctionCompileEvent;
import io.github.eutro.decompir.api.events.ReducedEvent;
import io.github.eutro.decompir.api.events.RunFunctionCompilationEvent;
import io.github.eutro.decompir.api.events.SubstitutedEvent;
import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.passes.meta.ComputeLiveness;
import io.github.eutro.decompir.core.passes.opts.ReduceTree;
import io.github.eutro.decompir.core.passes.opts.SubstituteExprs;
import org.jetbrains.annotations.NotNull;

/**
 * Represents the decompilation of a single function.
 * <p>
 * When {@link #run()} is called:
 * <ol>
 *     <li>{@link RunFunctionCompilationEvent} is fired on the {@link Decompiler decompiler}.</li>
 *     <li>Definitions are {@link SubstituteExprs substituted} into their uses, unless disabled.</li>
 *     <li>{@link SubstitutedEvent} is fired.</li>
 *     <li>{@link ComputeLiveness Liveness} is computed and the body is {@link ReduceTree reduced}.</li>
 *     <li>{@link ReducedEvent} is fired.</li>
 * </ol>
 */
public class FunctionCompilation extends EventSupplier<FunctionCompileEvent> {
    private final Decompiler dc;

    /**
     * The function being decompiled.
     */
    @NotNull
    public Function function;

    FunctionCompilation(Decompiler dc, @NotNull Function function) {
        this.dc = dc;
        this.function = function;
    }

    /**
     * Run the compilation.
     * <p>
     * Any exception thrown by a pass or a listener propagates.
     *
     * @return The reduced function.
     */
    public Function run() {
        dc.dispatch(RunFunctionCompilationEvent.class, new RunFunctionCompilationEvent(this));
        DecompilerConfig config = dc.getConfig();

        Function func = function;
        if (config.substitute) {
            SubstituteExprs.INSTANCE.run(func);
        }
        func = dispatch(SubstitutedEvent.class, new SubstitutedEvent(func)).function;

        ComputeLiveness.INSTANCE
                .then(new ReduceTree(config.macros))
                .run(func);
        func = dispatch(ReducedEvent.class, new ReducedEvent(func)).function;
        function = func;
        return func;
    }
}
