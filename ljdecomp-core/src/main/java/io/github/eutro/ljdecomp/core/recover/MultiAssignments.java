package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Merges the stores of a multiple assignment.
 * <p>
 * {@code a, b = x, y} evaluates {@code x} and {@code y} into consecutive temporaries, then
 * stores them last target first. The first store's value may also be a constant.
 */
final class MultiAssignments extends SequenceRewrite {
    private final SlotNames names;

    MultiAssignments(SlotNames names) {
        this.names = names;
    }

    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (int i = 0; i < seq.nodes.size(); i++) {
            int length = runAt(seq, i);
            if (length < 2) continue;
            List<ExprStatement> run = new ArrayList<>(length);
            for (int k = i; k < i + length; k++) {
                run.add((ExprStatement) seq.nodes.get(k));
            }
            Collections.reverse(run);
            List<Expr> targets = new ArrayList<>(length);
            List<Expr> values = new ArrayList<>(length);
            for (ExprStatement store : run) {
                targets.add(store.targets.get(0));
                values.add(store.values.get(0));
            }
            ExprStatement merged = new ExprStatement(targets, values, run.get(length - 1).pc);
            seq.nodes.subList(i, i + length).clear();
            seq.nodes.add(i, merged);
            changed = true;
        }
        return changed;
    }

    private int runAt(Sequence seq, int start) {
        ExprStatement first = store(seq, start);
        if (first == null) return 0;
        Expr firstValue = first.values.get(0);
        int previous;
        if (firstValue instanceof Expr.Register && !names.isNamed((Expr.Register) firstValue)) {
            previous = ((Expr.Register) firstValue).slot;
        } else if (firstValue instanceof Expr.Constant) {
            previous = -1;
        } else {
            return 0;
        }
        List<Integer> slots = new ArrayList<>();
        if (previous >= 0) slots.add(previous);
        int length = 1;
        for (int k = start + 1; k < seq.nodes.size(); k++) {
            ExprStatement next = store(seq, k);
            if (next == null || !(next.values.get(0) instanceof Expr.Register)) break;
            Expr.Register value = (Expr.Register) next.values.get(0);
            if (names.isNamed(value) || previous >= 0 && value.slot != previous - 1) break;
            previous = value.slot;
            slots.add(previous);
            length++;
        }
        if (length < 2) return length;
        for (int k = start; k < start + length; k++) {
            Expr target = ((ExprStatement) seq.nodes.get(k)).targets.get(0);
            for (int slot : slots) {
                if (target instanceof Expr.Register
                        ? ((Expr.Register) target).slot == slot
                        : Statements.countReads(target, slot) != 0) {
                    return 0;
                }
            }
        }
        return length;
    }

    private ExprStatement store(Sequence seq, int at) {
        ExprStatement stmt = Statements.single(seq.nodes.get(at));
        if (stmt == null) return null;
        Expr target = stmt.targets.get(0);
        if (target instanceof Expr.Register && !names.isNamed((Expr.Register) target)) return null;
        return stmt;
    }
}
