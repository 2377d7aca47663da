package io.github.eutro.ljdecomp.core.bc;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A fully read dump.
 */
public final class BytecodeDump {
    public final FormatVersion version;
    public final int flags;
    public final @Nullable String chunkName;
    /**
     * All prototypes, root first, then nested prototypes depth-first.
     */
    public final List<BytecodeFunction> functions;

    BytecodeDump(FormatVersion version, int flags, @Nullable String chunkName, List<BytecodeFunction> functions) {
        this.version = version;
        this.flags = flags;
        this.chunkName = chunkName;
        this.functions = Collections.unmodifiableList(functions);
    }

    public BytecodeFunction getRoot() {
        return functions.get(0);
    }

    public boolean isStripped() {
        return (flags & DumpFlags.STRIP) != 0;
    }

    public boolean hasTwoSlotFrames() {
        return (flags & DumpFlags.FR2) != 0;
    }
}
