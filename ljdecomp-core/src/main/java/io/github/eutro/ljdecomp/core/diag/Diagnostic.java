package io.github.eutro.ljdecomp.core.diag;

import java.util.Collections;
import java.util.List;

/**
 * One reported problem.
 */
public final class Diagnostic {
    /**
     * The function index used for problems with the dump as a whole.
     */
    public static final int DUMP = -1;

    public final DiagnosticKind kind;
    public final int functionIndex;
    public final String message;
    /**
     * Instruction offsets of the blocks involved, in ascending order; may be empty.
     */
    public final List<Integer> offsets;

    public Diagnostic(DiagnosticKind kind, int functionIndex, String message, List<Integer> offsets) {
        this.kind = kind;
        this.functionIndex = functionIndex;
        this.message = message;
        this.offsets = Collections.unmodifiableList(offsets);
    }

    public Severity getSeverity() {
        return kind.severity;
    }

    @Override
    public String toString() {
        return kind.severity + " " + kind
                + (functionIndex == DUMP ? "" : " in function " + functionIndex)
                + ": " + message
                + (offsets.isEmpty() ? "" : " " + offsets);
    }
}
