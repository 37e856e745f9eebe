package io.github.eutro.decompir.core.ext;

import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.passes.IRPass;
import io.github.eutro.decompir.core.passes.meta.ComputeAddressTaken;
import io.github.eutro.decompir.core.passes.meta.ComputeLiveness;
import io.github.eutro.decompir.core.passes.meta.ComputeUseDefs;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which analyses of a {@link Function} are up to date with its body.
 */
public class MetadataState {
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata which can be recomputed by running in-place passes.
     *
     * @param <T> The type of IR the metadata is about.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        private ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("pass " + pass + " is not in-place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Function>
            ADDRESS_TAKEN = new ComputableMetaKind<>("ADDRESS_TAKEN", ComputeAddressTaken.INSTANCE),
            USE_DEFS = new ComputableMetaKind<>("USE_DEFS", ComputeUseDefs.INSTANCE),
            LIVENESS = new ComputableMetaKind<>("LIVENESS", ComputeLiveness.INSTANCE);

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Recompute each of the given kinds of metadata that is not currently valid.
     *
     * @param t     The IR.
     * @param kinds The kinds of metadata.
     * @param <T>   The type of the IR.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (!isValid(kind)) {
                kind.computeFor(t);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Called when the body of a function is replaced. Every analysis is keyed by node id,
     * so all of them go stale and their exts are removed from the function.
     *
     * @param func The function whose body was replaced.
     */
    public void bodyChanged(ExtContainer func) {
        invalidate(ADDRESS_TAKEN, USE_DEFS, LIVENESS);
        func.removeExt(CommonExts.ADDRESS_TAKEN);
        func.removeExt(CommonExts.INSTR_USE_DEFS);
        func.removeExt(CommonExts.LIVE_VARS);
    }
}
