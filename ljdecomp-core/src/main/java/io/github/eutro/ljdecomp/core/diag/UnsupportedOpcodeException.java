package io.github.eutro.ljdecomp.core.diag;

/**
 * Thrown when a function contains an opcode that the configured format version
 * does not define, or that cannot be decompiled.
 */
public class UnsupportedOpcodeException extends DecompilationException {
    private final int opcode;
    private final int pc;

    public UnsupportedOpcodeException(int opcode, int pc, String detail) {
        super(DiagnosticKind.UNSUPPORTED_OPCODE, "opcode " + opcode + " at pc " + pc + ": " + detail);
        this.opcode = opcode;
        this.pc = pc;
    }

    public int getOpcode() {
        return opcode;
    }

    public int getPc() {
        return pc;
    }
}
