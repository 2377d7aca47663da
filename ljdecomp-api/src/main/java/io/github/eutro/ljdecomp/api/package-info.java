/**
 * A configurable API over the lower-level core decompiler.
 * <p>
 * The main entrypoint to this API is the {@link io.github.eutro.ljdecomp.api.Decompiler},
 * to which bytecode dumps can be submitted for decompilation.
 * <p>
 * Decompilation can be observed and extended using the
 * {@link io.github.eutro.ljdecomp.api.events events API}.
 */
package io.github.eutro.ljdecomp.api;
