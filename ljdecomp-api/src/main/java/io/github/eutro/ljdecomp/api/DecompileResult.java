package io.github.eutro.ljdecomp.api;

import io.github.eutro.ljdecomp.core.bc.BytecodeDump;
import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import io.github.eutro.ljdecomp.core.diag.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a {@link DumpDecompilation}: one {@link FunctionResult} per function, in dump order.
 */
public final class DecompileResult {
    public final BytecodeDump dump;
    public final List<FunctionResult> functions;
    /**
     * Diagnostics about the dump as a whole.
     */
    public final List<Diagnostic> diagnostics;

    public DecompileResult(BytecodeDump dump, List<FunctionResult> functions, List<Diagnostic> diagnostics) {
        this.dump = dump;
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public FunctionResult getFunction(int index) {
        return functions.get(index);
    }

    /**
     * @return The dump's diagnostics, then each function's, in dump order.
     */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(diagnostics);
        for (FunctionResult function : functions) {
            all.addAll(function.diagnostics);
        }
        return all;
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : allDiagnostics()) {
            if (diagnostic.getSeverity() == Severity.ERROR) return true;
        }
        return false;
    }
}
