package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.GenericFor;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;

import java.util.Collections;
import java.util.List;

/**
 * {@code f, s, c = pairs(t); for k, v in f, s, c do} is {@code for k, v in pairs(t) do}.
 */
final class IteratorTripleIdiom extends SequenceRewrite {
    private final SlotNames names;

    IteratorTripleIdiom(SlotNames names) {
        this.names = names;
    }

    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (int i = 0; i + 1 < seq.nodes.size(); i++) {
            StructuredNode node = seq.nodes.get(i);
            StructuredNode next = seq.nodes.get(i + 1);
            if (!(node instanceof ExprStatement) || !(next instanceof GenericFor)) continue;
            ExprStatement def = (ExprStatement) node;
            GenericFor loop = (GenericFor) next;
            if (def.values.size() != 1 || !def.values.get(0).isMultiValued()
                    || !sameRegisters(def.targets, loop.iterators)) {
                continue;
            }
            loop.iterators = Collections.singletonList(def.values.get(0));
            seq.nodes.remove(i);
            changed = true;
        }
        return changed;
    }

    private boolean sameRegisters(List<Expr> targets, List<Expr> iterators) {
        if (targets.size() != 3 || iterators.size() != 3) return false;
        for (int k = 0; k < 3; k++) {
            Expr target = targets.get(k);
            if (!(target instanceof Expr.Register) || names.isNamed((Expr.Register) target)) return false;
            int slot = ((Expr.Register) target).slot;
            if (k > 0 && slot != ((Expr.Register) targets.get(k - 1)).slot + 1) return false;
            if (!Statements.isRegister(iterators.get(k), slot)) return false;
        }
        return true;
    }
}
