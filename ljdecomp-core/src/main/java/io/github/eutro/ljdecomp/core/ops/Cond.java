package io.github.eutro.ljdecomp.core.ops;

import io.github.eutro.ljdecomp.core.tree.BinOp;
import org.jetbrains.annotations.Nullable;

/**
 * The test of a conditional branch. Comparisons take two operands, the rest one.
 */
public enum Cond {
    LT(BinOp.LT),
    GE(BinOp.GE),
    LE(BinOp.LE),
    GT(BinOp.GT),
    EQ(BinOp.EQ),
    NE(BinOp.NE),
    TRUTHY(null),
    FALSY(null),
    ;

    /**
     * The operator this comparison prints as, or null for truth tests.
     */
    public final @Nullable BinOp op;

    Cond(@Nullable BinOp op) {
        this.op = op;
    }

    public int arity() {
        return op == null ? 1 : 2;
    }

    public Cond negate() {
        return values()[ordinal() ^ 1];
    }
}
