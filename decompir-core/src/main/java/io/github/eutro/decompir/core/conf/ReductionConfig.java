package io.github.eutro.decompir.core.conf;

import io.github.eutro.decompir.core.flow.LiveVars;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The inputs of one tree reduction.
 * <p>
 * Each table is optional. An absent table means no data was supplied, which is not the same
 * as an empty one: without liveness, no assignment is proven dead.
 */
public final class ReductionConfig {
    @Nullable
    private final LiveVars liveness;
    @Nullable
    private final Map<Integer, Integer> remap;
    @Nullable
    private final Map<Long, String> macros;

    private ReductionConfig(Builder builder) {
        this.liveness = builder.liveness;
        this.remap = builder.remap == null ? null : Collections.unmodifiableMap(new HashMap<>(builder.remap));
        this.macros = builder.macros == null ? null : Collections.unmodifiableMap(new HashMap<>(builder.macros));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the liveness used to prove assignments dead.
     *
     * @return The liveness, if supplied.
     */
    public Optional<LiveVars> getLiveness() {
        return Optional.ofNullable(liveness);
    }

    /**
     * Get the table of ids that a folded node takes instead of its own.
     *
     * @return The remap table, if supplied.
     */
    public Optional<Map<Integer, Integer>> getRemap() {
        return Optional.ofNullable(remap);
    }

    /**
     * Get the symbolic names of constant values.
     *
     * @return The macro table, if supplied.
     */
    public Optional<Map<Long, String>> getMacros() {
        return Optional.ofNullable(macros);
    }

    public static final class Builder {
        private LiveVars liveness;
        private Map<Integer, Integer> remap;
        private Map<Long, String> macros;

        private Builder() {
        }

        public Builder liveness(@Nullable LiveVars liveness) {
            this.liveness = liveness;
            return this;
        }

        public Builder remap(@Nullable Map<Integer, Integer> remap) {
            this.remap = remap;
            return this;
        }

        public Builder macros(@Nullable Map<Long, String> macros) {
            this.macros = macros;
            return this;
        }

        public ReductionConfig build() {
            return new ReductionConfig(this);
        }
    }
}
