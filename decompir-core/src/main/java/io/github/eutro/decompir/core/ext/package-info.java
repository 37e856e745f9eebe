/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.decompir.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Function func = ...;
 * InstrUseDef useDefs = func.getExtOrRun(CommonExts.INSTR_USE_DEFS, func, ComputeUseDefs.INSTANCE);
 * }</pre>
 * <p>
 * Analyses never annotate the nodes of a tree, which are immutable. Instead their results are
 * attached to the {@link io.github.eutro.decompir.core.ast.Function} owning the tree,
 * keyed by node id, and are invalidated through the
 * {@link io.github.eutro.decompir.core.ext.MetadataState} when the body is replaced.
 */
package io.github.eutro.decompir.core.ext;
