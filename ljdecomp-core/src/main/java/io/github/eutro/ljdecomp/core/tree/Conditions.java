package io.github.eutro.ljdecomp.core.tree;

import io.github.eutro.ljdecomp.core.bc.Primitive;

public final class Conditions {
    private Conditions() {
    }

    /**
     * Negate a condition, flipping comparisons rather than wrapping them.
     * <p>
     * Flipping follows LuaJIT, which itself compiles {@code not (a < b)} as {@code a >= b}.
     * Conjunctions and disjunctions are negated operand-wise, so {@code not (not a or not b)}
     * becomes {@code a and b}.
     *
     * @param cond The condition.
     * @return An expression truthy exactly when {@code cond} is not.
     */
    public static Expr not(Expr cond) {
        if (cond instanceof Expr.Binary) {
            Expr.Binary bin = (Expr.Binary) cond;
            if (bin.op == BinOp.AND) return or(not(bin.lhs), not(bin.rhs));
            if (bin.op == BinOp.OR) return and(not(bin.lhs), not(bin.rhs));
            BinOp negated = bin.op.negated();
            if (negated != null) return new Expr.Binary(negated, bin.lhs, bin.rhs);
        } else if (cond instanceof Expr.Unary && ((Expr.Unary) cond).op == UnOp.NOT) {
            return ((Expr.Unary) cond).operand;
        } else if (cond instanceof Expr.Constant) {
            Object value = ((Expr.Constant) cond).value;
            if (value == Primitive.TRUE) return Expr.Constant.of(false);
            if (value == Primitive.FALSE || value == Primitive.NIL) return Expr.Constant.of(true);
        }
        return new Expr.Unary(UnOp.NOT, cond);
    }

    public static Expr and(Expr lhs, Expr rhs) {
        return new Expr.Binary(BinOp.AND, lhs, rhs);
    }

    public static Expr or(Expr lhs, Expr rhs) {
        return new Expr.Binary(BinOp.OR, lhs, rhs);
    }

    public static boolean isTrue(Expr cond) {
        return cond instanceof Expr.Constant && ((Expr.Constant) cond).isTrue();
    }
}
