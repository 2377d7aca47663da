package io.github.eutro.ljdecomp.core.bc;

import io.github.eutro.ljdecomp.core.diag.DecompilationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One function prototype of a dump. Immutable once read.
 */
public final class BytecodeFunction {
    /**
     * Position in the dump's output order: root first, then nested prototypes depth-first.
     */
    public final int index;
    /**
     * The byte offset of the prototype within the dump.
     */
    public final long dumpOffset;
    public final int flags;
    public final int numParams;
    public final int frameSize;
    /**
     * Whether calls reserve two slots for frame info, shifting their arguments up by one.
     */
    public final boolean twoSlotFrames;
    public final List<UpvalueRef> upvalues;
    private final List<Object> gcConstants;
    public final List<Object> numConstants;
    private final int[] code;
    private final @Nullable List<Instruction> instructions;
    private final @Nullable DecompilationException decodeFailure;
    public final @Nullable DebugInfo debugInfo;
    public final List<BytecodeFunction> children;

    BytecodeFunction(
            int index,
            long dumpOffset,
            int flags,
            int numParams,
            int frameSize,
            boolean twoSlotFrames,
            List<UpvalueRef> upvalues,
            List<Object> gcConstants,
            List<Object> numConstants,
            int[] code,
            @Nullable DebugInfo debugInfo,
            List<BytecodeFunction> children,
            FormatVersion version
    ) {
        this.index = index;
        this.dumpOffset = dumpOffset;
        this.flags = flags;
        this.numParams = numParams;
        this.frameSize = frameSize;
        this.twoSlotFrames = twoSlotFrames;
        this.upvalues = Collections.unmodifiableList(new ArrayList<>(upvalues));
        this.gcConstants = Collections.unmodifiableList(new ArrayList<>(gcConstants));
        this.numConstants = Collections.unmodifiableList(new ArrayList<>(numConstants));
        this.code = code.clone();
        this.debugInfo = debugInfo;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));

        List<Instruction> decoded = null;
        DecompilationException failure = null;
        try {
            decoded = new InstructionDecoder(this, version).decode(code);
        } catch (DecompilationException e) {
            failure = e;
        }
        instructions = decoded == null ? null : Collections.unmodifiableList(decoded);
        decodeFailure = failure;
    }

    /**
     * Resolve a GC constant operand, which counts from the end of the table.
     *
     * @param operand The D (or C) operand.
     * @return The constant: a {@link String}, {@link TableConstant},
     * {@link CDataConstant} or child {@link BytecodeFunction}.
     */
    public Object gcConstant(int operand) {
        return gcConstants.get(gcConstants.size() - 1 - operand);
    }

    public int gcConstantCount() {
        return gcConstants.size();
    }

    public Object numConstant(int operand) {
        return numConstants.get(operand);
    }

    public boolean isVararg() {
        return (flags & DumpFlags.PROTO_VARARG) != 0;
    }

    /**
     * The raw instruction words, without the function header instruction.
     *
     * @return A copy of the words.
     */
    public int[] getCode() {
        return code.clone();
    }

    public int size() {
        return code.length;
    }

    /**
     * Get the decoded instructions.
     *
     * @return The instructions.
     * @throws DecompilationException The decoding failure, if decoding failed.
     */
    public List<Instruction> getInstructions() {
        if (decodeFailure != null) throw decodeFailure;
        assert instructions != null;
        return instructions;
    }

    public @Nullable DecompilationException getDecodeFailure() {
        return decodeFailure;
    }

    public @Nullable String upvalueName(int index) {
        if (debugInfo == null || index >= debugInfo.upvalueNames.size()) return null;
        return debugInfo.upvalueNames.get(index);
    }

    @Override
    public String toString() {
        return "function#" + index;
    }
}
