package io.github.eutro.ljdecomp.api.events;

import io.github.eutro.ljdecomp.api.Decompiler;
import io.github.eutro.ljdecomp.api.DumpDecompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired on the decompiler when a dump decompilation starts, before the dump is read.
 * <p>
 * Listeners can use it to listen to the events of the decompilation.
 *
 * @see Decompiler
 */
public class RunDumpDecompilationEvent implements DecompilerEvent {
    @NotNull
    public final DumpDecompilation decompilation;

    public RunDumpDecompilationEvent(@NotNull DumpDecompilation decompilation) {
        this.decompilation = decompilation;
    }
}
