package io.github.eutro.ljdecomp.api.events;

import io.github.eutro.ljdecomp.api.DumpDecompilation;

/**
 * An event fired during the decompilation of a single dump.
 *
 * @see DumpDecompilation
 */
public interface DumpDecompileEvent {
}
