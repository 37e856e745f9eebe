package io.github.eutro.decompir.api.events;

import io.github.eutro.decompir.api.Decompiler;

/**
 * An event fired on a {@link Decompiler}.
 */
public interface DecompilerEvent {
}
