package io.github.eutro.decompir.core.passes.meta;

import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.MetadataState;
import io.github.eutro.decompir.core.passes.InPlaceIRPass;

import java.util.Collections;
import java.util.LinkedHashSet;

/**
 * Computes the {@link CommonExts#ADDRESS_TAKEN} set of a function.
 */
public class ComputeAddressTaken implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeAddressTaken INSTANCE = new ComputeAddressTaken();

    @Override
    public void runInPlace(Function func) {
        func.attachExt(CommonExts.ADDRESS_TAKEN,
                Collections.unmodifiableSet(new LinkedHashSet<>(func.getBody().addressTaken())));
        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.ADDRESS_TAKEN);
    }
}
