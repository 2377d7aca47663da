package io.github.eutro.ljdecomp.api.events;

import io.github.eutro.ljdecomp.api.FunctionResult;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a function is done, whether or not it decompiled.
 */
public class FunctionDecompiledEvent implements DumpDecompileEvent {
    @NotNull
    public final FunctionResult result;

    public FunctionDecompiledEvent(@NotNull FunctionResult result) {
        this.result = result;
    }
}
