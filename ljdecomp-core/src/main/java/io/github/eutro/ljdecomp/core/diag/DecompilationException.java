package io.github.eutro.ljdecomp.core.diag;

/**
 * Thrown when input cannot be decompiled.
 */
public class DecompilationException extends RuntimeException {
    private final DiagnosticKind kind;

    public DecompilationException(DiagnosticKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DecompilationException(DiagnosticKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Get the kind of diagnostic this failure is reported as.
     *
     * @return The kind.
     */
    public DiagnosticKind getKind() {
        return kind;
    }
}
