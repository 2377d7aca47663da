package io.github.eutro.ljdecomp.core.diag;

/**
 * Thrown when the input violates the structure of a bytecode dump.
 * <p>
 * Raised by the reader this aborts the whole dump, and the offset is a byte offset into the dump.
 * Raised while decoding or building a single function it only aborts that function, and the
 * offset is the instruction offset (pc) in that function; see {@link #atInstruction(int, String)}.
 */
public class MalformedBytecodeException extends DecompilationException {
    private final long offset;
    private final boolean instructionOffset;
    private final String expectation;

    private MalformedBytecodeException(long offset, boolean instructionOffset, String expectation) {
        super(DiagnosticKind.MALFORMED_BYTECODE,
                (instructionOffset ? "at pc " : "at byte ") + offset + ": expected " + expectation);
        this.offset = offset;
        this.instructionOffset = instructionOffset;
        this.expectation = expectation;
    }

    /**
     * @param offset      The byte offset in the dump where the violation was found.
     * @param expectation What was expected there.
     */
    public MalformedBytecodeException(long offset, String expectation) {
        this(offset, false, expectation);
    }

    /**
     * Create an exception for a violation inside one function's instructions.
     *
     * @param pc          The offset of the offending instruction.
     * @param expectation What was expected there.
     * @return The exception.
     */
    public static MalformedBytecodeException atInstruction(int pc, String expectation) {
        return new MalformedBytecodeException(pc, true, expectation);
    }

    /**
     * @return The byte offset in the dump, or the instruction offset if {@link #isInstructionOffset()}.
     */
    public long getOffset() {
        return offset;
    }

    public boolean isInstructionOffset() {
        return instructionOffset;
    }

    public String getExpectation() {
        return expectation;
    }
}
