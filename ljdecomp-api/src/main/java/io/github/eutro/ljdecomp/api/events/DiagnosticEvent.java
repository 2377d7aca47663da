package io.github.eutro.ljdecomp.api.events;

import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import org.jetbrains.annotations.NotNull;

/**
 * Fired for every diagnostic as it is reported.
 * <p>
 * Cancelling only stops later listeners; the diagnostic is still part of the result.
 */
public class DiagnosticEvent implements DumpDecompileEvent, CancellableEvent {
    @NotNull
    public final Diagnostic diagnostic;
    private volatile boolean cancelled;

    public DiagnosticEvent(@NotNull Diagnostic diagnostic) {
        this.diagnostic = diagnostic;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
