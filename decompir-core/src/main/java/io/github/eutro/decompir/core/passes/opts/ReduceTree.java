package io.github.eutro.decompir.core.passes.opts;

import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.conf.ReductionConfig;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.MetadataState;
import io.github.eutro.decompir.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Reduces the body of a function with a {@link TreeReducer}, using the function's
 * current liveness.
 */
public class ReduceTree implements InPlaceIRPass<Function> {
    /**
     * A reduction without macro names.
     */
    public static final ReduceTree INSTANCE = new ReduceTree(null);

    @Nullable
    private final Map<Long, String> macros;

    public ReduceTree(@Nullable Map<Long, String> macros) {
        this.macros = macros;
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.LIVENESS);
        ReductionConfig config = ReductionConfig.builder()
                .liveness(func.getExtOrThrow(CommonExts.LIVE_VARS))
                .macros(macros)
                .build();
        func.setBody(new TreeReducer(config).reduce(func.getBody()));
    }
}
