package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.bc.Primitive;
import io.github.eutro.ljdecomp.core.tree.Conditions;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.If;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.UnOp;

import java.util.Collections;

/**
 * Turns {@code if c then x = a else x = b end} back into a single assignment:
 * {@code x = c} for booleans, {@code x = c and a or b} when {@code a} is a truthy constant.
 */
final class BooleanValueIdiom extends SequenceRewrite {
    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (int i = 0; i < seq.nodes.size(); i++) {
            StructuredNode node = seq.nodes.get(i);
            if (!(node instanceof If)) continue;
            If anIf = (If) node;
            if (anIf.orElse == null || anIf.then.nodes.size() != 1 || anIf.orElse.nodes.size() != 1) continue;
            Expr.Register thenTarget = Statements.registerDef(anIf.then.nodes.get(0));
            Expr.Register elseTarget = Statements.registerDef(anIf.orElse.nodes.get(0));
            if (thenTarget == null || elseTarget == null || thenTarget.slot != elseTarget.slot) continue;
            ExprStatement assign = (ExprStatement) anIf.then.nodes.get(0);
            Expr a = assign.values.get(0);
            Expr b = ((ExprStatement) anIf.orElse.nodes.get(0)).values.get(0);
            Expr value = combine(anIf.cond, a, b);
            if (value == null) continue;
            assign.values = Collections.singletonList(value);
            seq.nodes.set(i, assign);
            changed = true;
        }
        return changed;
    }

    private static Expr combine(Expr cond, Expr a, Expr b) {
        boolean bool = isBoolean(cond);
        if (bool && isConstant(a, Primitive.TRUE) && isConstant(b, Primitive.FALSE)) return cond;
        if (bool && isConstant(a, Primitive.FALSE) && isConstant(b, Primitive.TRUE)) return Conditions.not(cond);
        if (a instanceof Expr.Constant
                && ((Expr.Constant) a).value != Primitive.NIL
                && ((Expr.Constant) a).value != Primitive.FALSE) {
            return Conditions.or(Conditions.and(cond, a), b);
        }
        return null;
    }

    private static boolean isBoolean(Expr cond) {
        if (cond instanceof Expr.Binary) return ((Expr.Binary) cond).op.isComparison();
        return cond instanceof Expr.Unary && ((Expr.Unary) cond).op == UnOp.NOT;
    }

    private static boolean isConstant(Expr expr, Primitive value) {
        return expr instanceof Expr.Constant && ((Expr.Constant) expr).value == value;
    }
}
