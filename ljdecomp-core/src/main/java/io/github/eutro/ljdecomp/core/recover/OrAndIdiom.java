package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.BinOp;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.If;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.UnOp;

import java.util.Collections;

/**
 * {@code x = a; if not x then x = b end} is {@code x = a or b}, and
 * {@code x = a; if x then x = b end} is {@code x = a and b}.
 */
final class OrAndIdiom extends SequenceRewrite {
    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (int i = 0; i + 1 < seq.nodes.size(); i++) {
            Expr.Register target = Statements.registerDef(seq.nodes.get(i));
            StructuredNode next = seq.nodes.get(i + 1);
            if (target == null || !(next instanceof If)) continue;
            If anIf = (If) next;
            if (anIf.orElse != null && !anIf.orElse.isEmpty() || anIf.then.nodes.size() != 1) continue;
            Expr.Register armTarget = Statements.registerDef(anIf.then.nodes.get(0));
            if (armTarget == null || armTarget.slot != target.slot) continue;
            BinOp op;
            if (Statements.isRegister(anIf.cond, target.slot)) {
                op = BinOp.AND;
            } else if (anIf.cond instanceof Expr.Unary
                    && ((Expr.Unary) anIf.cond).op == UnOp.NOT
                    && Statements.isRegister(((Expr.Unary) anIf.cond).operand, target.slot)) {
                op = BinOp.OR;
            } else {
                continue;
            }
            Expr rhs = ((ExprStatement) anIf.then.nodes.get(0)).values.get(0);
            if (Statements.countReads(rhs, target.slot) != 0) continue;
            ExprStatement def = (ExprStatement) seq.nodes.get(i);
            def.values = Collections.singletonList(new Expr.Binary(op, def.values.get(0), rhs));
            seq.nodes.remove(i + 1);
            i--;
            changed = true;
        }
        return changed;
    }
}
