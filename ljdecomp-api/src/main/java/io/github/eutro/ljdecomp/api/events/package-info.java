/**
 * Events that occur during a decompilation.
 * <p>
 * These can be used to run extra passes, collect diagnostics, and the like.
 * <p>
 * The API revolves around {@link io.github.eutro.ljdecomp.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.ljdecomp.api.events;
