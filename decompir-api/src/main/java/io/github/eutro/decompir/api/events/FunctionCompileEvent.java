package io.github.eutro.decompir.api.events;

import io.github.eutro.decompir.api.FunctionCompilation;

/**
 * An event fired during the decompilation of a single function.
 *
 * @see FunctionCompilation
 */
public interface FunctionCompileEvent {
}
