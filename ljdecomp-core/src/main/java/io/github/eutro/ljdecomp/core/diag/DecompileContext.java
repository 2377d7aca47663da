package io.github.eutro.ljdecomp.core.diag;

import io.github.eutro.ljdecomp.core.bc.FormatVersion;

/**
 * The state threaded through one function's trip down the pipeline:
 * the format version and where diagnostics go.
 */
public final class DecompileContext {
    public final FormatVersion version;
    public final Diagnostics diagnostics;
    /**
     * The index of the function being decompiled, or {@link Diagnostic#DUMP}.
     */
    public final int functionIndex;

    public DecompileContext(FormatVersion version, Diagnostics diagnostics, int functionIndex) {
        this.version = version;
        this.diagnostics = diagnostics;
        this.functionIndex = functionIndex;
    }

    public DecompileContext(FormatVersion version) {
        this(version, new Diagnostics(), Diagnostic.DUMP);
    }

    /**
     * Derive a context for one function, with its own diagnostics.
     *
     * @param functionIndex The function's index.
     * @return The new context.
     */
    public DecompileContext forFunction(int functionIndex) {
        return new DecompileContext(version, new Diagnostics(), functionIndex);
    }

    public void report(DiagnosticKind kind, String message, Integer... offsets) {
        diagnostics.report(kind, functionIndex, message, offsets);
    }
}
