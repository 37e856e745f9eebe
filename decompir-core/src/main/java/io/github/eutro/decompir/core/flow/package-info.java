/**
 * Dataflow facts over a function tree.
 * <p>
 * These are plain indexes keyed by node id. They are computed by the passes in
 * {@link io.github.eutro.decompir.core.passes.meta} and attached to the
 * {@link io.github.eutro.decompir.core.ast.Function} through {@link io.github.eutro.decompir.core.ext.CommonExts}.
 */
package io.github.eutro.decompir.core.flow;
