package io.github.eutro.ljdecomp.api.events;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.ir.Function;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after a function is lowered to IR, before its control flow graph is normalized.
 * <p>
 * Listeners may run extra passes over the IR, or replace it. Passes that change the
 * blocks must invalidate the metadata they touch.
 */
public class IrPassesEvent implements DumpDecompileEvent {
    @NotNull
    public final BytecodeFunction function;
    /**
     * The IR, which the rest of the pipeline continues with.
     */
    @NotNull
    public Function ir;

    public IrPassesEvent(@NotNull BytecodeFunction function, @NotNull Function ir) {
        this.function = function;
        this.ir = ir;
    }
}
