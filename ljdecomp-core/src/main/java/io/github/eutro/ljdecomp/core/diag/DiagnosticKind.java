package io.github.eutro.ljdecomp.core.diag;

/**
 * The kinds of problem the pipeline reports.
 */
public enum DiagnosticKind {
    MALFORMED_BYTECODE(Severity.ERROR),
    UNSUPPORTED_OPCODE(Severity.ERROR),
    /**
     * A stage failed for a reason not covered by the other kinds.
     */
    INTERNAL_ERROR(Severity.ERROR),
    UNREACHABLE_CODE(Severity.WARNING),
    IRREDUCIBLE_CONTROL_FLOW(Severity.WARNING),
    UNRESOLVED_DEBUG_NAME(Severity.WARNING),
    AMBIGUOUS_IDIOM_MATCH(Severity.INFO),
    ;

    public final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }
}
