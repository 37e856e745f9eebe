package io.github.eutro.decompir.core.passes;

import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.passes.meta.ComputeLiveness;
import io.github.eutro.decompir.core.passes.opts.ReduceTree;
import io.github.eutro.decompir.core.passes.opts.SubstituteExprs;

import java.util.Map;

public class Passes {
    /**
     * Substitute definitions, then reduce with liveness computed on the substituted body.
     */
    public static final IRPass<Function, Function> DEFAULT =
            SubstituteExprs.INSTANCE
                    .then(ComputeLiveness.INSTANCE)
                    .then(ReduceTree.INSTANCE);

    /**
     * Get the default pipeline, naming constants after the given macros.
     *
     * @param macros The macro names of constant values.
     * @return The pipeline.
     */
    public static IRPass<Function, Function> withMacros(Map<Long, String> macros) {
        return SubstituteExprs.INSTANCE
                .then(ComputeLiveness.INSTANCE)
                .then(new ReduceTree(macros));
    }
}
