package io.github.eutro.ljdecomp.core.bc;

/**
 * What an instruction operand refers to.
 */
public enum OperandMode {
    NONE,
    /** A destination register. */
    DST,
    /** The first of a run of registers. */
    BASE,
    /** A source register. */
    VAR,
    /** A register that may be one past the frame, e.g. the first free slot. */
    RBASE,
    UV,
    /** An unsigned literal. */
    LIT,
    /** A signed 16 bit literal. */
    LITS,
    /** {@code nil}, {@code false} or {@code true}. */
    PRI,
    NUM,
    STR,
    TAB,
    FUNC,
    CDATA,
    JUMP,
    ;

    /**
     * Whether the operand indexes the (reversed) garbage-collected constant table.
     *
     * @return Whether this is a GC constant operand.
     */
    public boolean isGcConstant() {
        return this == STR || this == TAB || this == FUNC || this == CDATA;
    }

    public boolean isRegister() {
        return this == DST || this == BASE || this == VAR || this == RBASE;
    }
}
