package io.github.eutro.ljdecomp.core.bc;

/**
 * Where a closure's upvalue comes from when it is created.
 */
public final class UpvalueRef {
    static final int LOCAL_FLAG = 0x8000;
    static final int IMMUTABLE_FLAG = 0x4000;

    /**
     * If true, {@link #index} is a register of the enclosing function; otherwise an upvalue of it.
     */
    public final boolean parentLocal;
    public final boolean immutable;
    public final int index;

    UpvalueRef(int raw) {
        parentLocal = (raw & LOCAL_FLAG) != 0;
        immutable = (raw & IMMUTABLE_FLAG) != 0;
        index = raw & ~(LOCAL_FLAG | IMMUTABLE_FLAG);
    }

    @Override
    public String toString() {
        return (parentLocal ? "local " : "upvalue ") + index + (immutable ? " (immutable)" : "");
    }
}
