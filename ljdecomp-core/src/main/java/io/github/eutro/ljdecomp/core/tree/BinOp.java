package io.github.eutro.ljdecomp.core.tree;

import org.jetbrains.annotations.Nullable;

/**
 * Binary operators, with the precedence a printer needs to parenthesize them.
 * Higher precedence binds tighter; unary operators sit at {@link UnOp#PRECEDENCE}.
 */
public enum BinOp {
    OR("or", 1),
    AND("and", 2),
    LT("<", 3),
    LE("<=", 3),
    GT(">", 3),
    GE(">=", 3),
    EQ("==", 3),
    NE("~=", 3),
    CONCAT("..", 4, true),
    ADD("+", 5),
    SUB("-", 5),
    MUL("*", 6),
    DIV("/", 6),
    MOD("%", 6),
    POW("^", 8, true),
    ;

    public final String symbol;
    public final int precedence;
    public final boolean rightAssociative;

    BinOp(String symbol, int precedence, boolean rightAssociative) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
    }

    BinOp(String symbol, int precedence) {
        this(symbol, precedence, false);
    }

    public boolean isComparison() {
        return precedence == 3;
    }

    /**
     * Get the comparison that holds exactly when this one does not, as LuaJIT defines it.
     *
     * @return The negated comparison, or null if this is not a comparison.
     */
    public @Nullable BinOp negated() {
        switch (this) {
            case LT:
                return GE;
            case GE:
                return LT;
            case LE:
                return GT;
            case GT:
                return LE;
            case EQ:
                return NE;
            case NE:
                return EQ;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
