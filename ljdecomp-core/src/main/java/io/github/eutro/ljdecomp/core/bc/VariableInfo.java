package io.github.eutro.ljdecomp.core.bc;

import org.jetbrains.annotations.Nullable;

/**
 * The debug record of one local variable.
 */
public final class VariableInfo {
    /**
     * Compiler-internal variables, in the order of their tag bytes 1 to 6.
     */
    public enum Kind {
        NAMED(null),
        FOR_INDEX("(for index)"),
        FOR_STOP("(for limit)"),
        FOR_STEP("(for step)"),
        FOR_GENERATOR("(for generator)"),
        FOR_STATE("(for state)"),
        FOR_CONTROL("(for control)"),
        ;

        public final @Nullable String internalName;

        Kind(@Nullable String internalName) {
            this.internalName = internalName;
        }
    }

    public final Kind kind;
    public final String name;
    /**
     * The first instruction offset at which the variable is live.
     */
    public final int startPc;
    /**
     * The first instruction offset at which the variable is no longer live.
     */
    public final int endPc;
    public final int slot;

    public VariableInfo(Kind kind, String name, int startPc, int endPc, int slot) {
        this.kind = kind;
        this.name = name;
        this.startPc = startPc;
        this.endPc = endPc;
        this.slot = slot;
    }

    public boolean isLiveAt(int pc) {
        return startPc <= pc && pc < endPc;
    }

    @Override
    public String toString() {
        return name + "@" + slot + "[" + startPc + ", " + endPc + ")";
    }
}
