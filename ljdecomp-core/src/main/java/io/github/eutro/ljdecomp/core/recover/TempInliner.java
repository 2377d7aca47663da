package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.RepeatUntil;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.TempFolding;
import io.github.eutro.ljdecomp.core.tree.Trees;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Substitutes temporaries into the statement that reads them.
 * <p>
 * A temporary is an unnamed register written once and read exactly once, by the statement
 * right after its run of definitions, and dead afterwards. Pending multiple results are
 * always substituted into the next statement.
 */
final class TempInliner {
    private final SlotNames names;

    TempInliner(SlotNames names) {
        this.names = names;
    }

    boolean run(StructuredFunction fn) {
        TreeLiveness liveness = TreeLiveness.compute(fn.root);
        List<Sequence> sequences = new ArrayList<>();
        Trees.forEachNode(fn.root, node -> {
            if (node.kind() == StructuredNode.Kind.SEQUENCE) sequences.add((Sequence) node);
        });
        boolean changed = false;
        for (Sequence seq : sequences) {
            changed |= inlineMultRes(seq);
            changed |= inlineTemps(seq, liveness);
        }
        return changed;
    }

    private boolean inlineMultRes(Sequence seq) {
        boolean changed = false;
        List<StructuredNode> nodes = seq.nodes;
        for (int i = 0; i + 1 < nodes.size(); i++) {
            StructuredNode node = nodes.get(i);
            if (!(node instanceof ExprStatement)) continue;
            ExprStatement def = (ExprStatement) node;
            if (def.targets.size() != 1 || !(def.targets.get(0) instanceof Expr.MultRes) || def.values.size() != 1) {
                continue;
            }
            StructuredNode consumer = nodes.get(i + 1);
            if (consumer.kind() == StructuredNode.Kind.SEQUENCE) continue;
            List<Expr.MultRes> reads = new ArrayList<>();
            for (Expr expr : consumer.exprs()) {
                expr.forEach(e -> {
                    if (e instanceof Expr.MultRes) reads.add((Expr.MultRes) e);
                });
            }
            if (reads.size() != 1) continue;
            Expr.MultRes read = reads.get(0);
            Expr value = def.values.get(0);
            consumer.rewriteExprs(e -> e.rewrite(x -> x == read ? value : x));
            nodes.remove(i--);
            changed = true;
        }
        return changed;
    }

    private boolean inlineTemps(Sequence seq, TreeLiveness liveness) {
        boolean changed = false;
        List<StructuredNode> nodes = seq.nodes;
        for (int i = 0; i < nodes.size(); i++) {
            StructuredNode consumer = nodes.get(i);
            int folded;
            switch (consumer.kind()) {
                case EXPR_STATEMENT: {
                    ExprStatement stmt = (ExprStatement) consumer;
                    folded = fold(nodes, i, consumer, stmt.values.size() < stmt.targets.size(), liveness.liveOut(consumer));
                    break;
                }
                case RETURN:
                case GENERIC_FOR:
                    folded = fold(nodes, i, consumer, true, liveness.liveOut(consumer));
                    break;
                case IF:
                case NUMERIC_FOR:
                    folded = fold(nodes, i, consumer, false, liveness.liveOut(consumer));
                    break;
                case REPEAT_UNTIL: {
                    RepeatUntil loop = (RepeatUntil) consumer;
                    BitSet after = (BitSet) liveness.liveOut(loop).clone();
                    after.or(liveness.liveIn(loop.body));
                    int n = fold(loop.body.nodes, loop.body.nodes.size(), consumer, false, after);
                    changed |= n > 0;
                    folded = 0;
                    break;
                }
                default:
                    folded = 0;
                    break;
            }
            if (folded > 0) {
                i -= folded;
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Fold the definitions right before {@code end} into the consumer's expressions, removing them.
     *
     * @return The number of definitions removed.
     */
    private int fold(List<StructuredNode> nodes, int end, StructuredNode consumer, boolean lastExpands, BitSet liveAfter) {
        List<TempFolding.Def> defs = new ArrayList<>();
        for (int k = end - 1; k >= 0; k--) {
            Expr.Register target = Statements.registerDef(nodes.get(k));
            if (target == null || names.isNamed(target)) break;
            Expr value = ((ExprStatement) nodes.get(k)).values.get(0);
            if (value instanceof Expr.MultRes || !isDeadAfter(consumer, target.slot, liveAfter)) break;
            defs.add(new TempFolding.Def(target.slot, value));
        }
        if (defs.isEmpty()) return 0;
        Collections.reverse(defs);
        List<Expr> exprs = new ArrayList<>(consumer.exprs());
        int folded = TempFolding.fold(defs, exprs, lastExpands, r -> !names.isNamed(r));
        if (folded == 0) return 0;
        Iterator<Expr> it = exprs.iterator();
        consumer.rewriteExprs(e -> it.next());
        nodes.subList(end - folded, end).clear();
        return folded;
    }

    private static boolean isDeadAfter(StructuredNode consumer, int slot, BitSet liveAfter) {
        int direct = TempFolding.countReads(consumer.exprs(), slot);
        if (Statements.countReads(consumer, slot) != direct) return false;
        return !liveAfter.get(slot) || Statements.writes(consumer, slot);
    }
}
