package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.tree.Expr;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * How control leaves a region.
 */
public final class Exit {
    public enum Kind {
        /**
         * The region returns; its body ends with a return.
         */
        TERMINAL,
        JUMP,
        /**
         * To {@code targets[0]} if {@link #cond} holds, else to {@code targets[1]}.
         */
        COND,
        /**
         * Numeric for entry: {@code targets[0]} is the body, {@code targets[1]} the exit.
         */
        FOR_PREP,
        /**
         * Numeric for step: {@code targets[0]} is the body, {@code targets[1]} the exit.
         */
        FOR_LOOP,
        /**
         * Generic for step: {@code targets[0]} is the body, {@code targets[1]} the exit.
         */
        ITER_LOOP,
    }

    public final Kind kind;
    public final Target[] targets;
    public final @Nullable Expr cond;
    /**
     * The base register of a loop exit.
     */
    public final int base;
    /**
     * The offset of the instruction this exit was lowered from, or -1.
     */
    public final int pc;

    private Exit(Kind kind, Target[] targets, @Nullable Expr cond, int base, int pc) {
        this.kind = kind;
        this.targets = targets;
        this.cond = cond;
        this.base = base;
        this.pc = pc;
    }

    public static Exit terminal() {
        return new Exit(Kind.TERMINAL, new Target[0], null, -1, -1);
    }

    public static Exit jump(Target target) {
        return new Exit(Kind.JUMP, new Target[]{target}, null, -1, -1);
    }

    public static Exit cond(Expr cond, Target taken, Target notTaken) {
        if (taken.equals(notTaken)) return jump(taken);
        return new Exit(Kind.COND, new Target[]{taken, notTaken}, cond, -1, -1);
    }

    public static Exit loop(Kind kind, int base, int pc, Target body, Target exit) {
        return new Exit(kind, new Target[]{body, exit}, null, base, pc);
    }

    public boolean isLoopControl() {
        return kind == Kind.FOR_PREP || kind == Kind.FOR_LOOP || kind == Kind.ITER_LOOP;
    }

    /**
     * @return Whether leaving the region never reaches another region: a return, or an escape.
     */
    public boolean isTerminalLike() {
        return kind == Kind.TERMINAL || kind == Kind.JUMP && targets[0].isEscape();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + (cond == null ? "" : " " + cond) + " " + Arrays.toString(targets);
    }
}
