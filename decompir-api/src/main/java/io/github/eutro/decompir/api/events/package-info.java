/**
 * Events that occur during a decompilation.
 * <p>
 * These can be used to observe intermediate trees, to run extra passes, or to report failures.
 * <p>
 * The API revolves around {@link io.github.eutro.decompir.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.decompir.api.events;
