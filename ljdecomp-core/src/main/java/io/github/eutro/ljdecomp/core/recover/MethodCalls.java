package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.TempFolding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns {@code f = o.m; self = o; f(self, ...)} into {@code o:m(...)}.
 * <p>
 * Runs on raw registers, before temporaries are inlined.
 */
final class MethodCalls extends SequenceRewrite {
    private final SlotNames names;

    MethodCalls(SlotNames names) {
        this.names = names;
    }

    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (int i = 0; i < seq.nodes.size(); i++) {
            StructuredNode consumer = seq.nodes.get(i);
            for (Expr.Call call : candidates(consumer)) {
                int removed = tryRewrite(seq.nodes, i, call);
                if (removed > 0) {
                    i -= removed;
                    changed = true;
                    break;
                }
            }
        }
        return changed;
    }

    private List<Expr.Call> candidates(StructuredNode consumer) {
        if (consumer.kind() == StructuredNode.Kind.SEQUENCE) return Collections.emptyList();
        List<Expr.Call> calls = new ArrayList<>();
        for (Expr expr : consumer.exprs()) {
            expr.forEach(e -> {
                if (!(e instanceof Expr.Call)) return;
                Expr.Call call = (Expr.Call) e;
                if (!call.method
                        && call.function instanceof Expr.Register
                        && !call.args.isEmpty()
                        && call.args.get(0) instanceof Expr.Register
                        && !names.isNamed((Expr.Register) call.function)
                        && !names.isNamed((Expr.Register) call.args.get(0))) {
                    calls.add(call);
                }
            });
        }
        return calls;
    }

    /**
     * @return The number of statements removed before {@code consumerAt}.
     */
    private int tryRewrite(List<StructuredNode> nodes, int consumerAt, Expr.Call call) {
        int fnSlot = ((Expr.Register) call.function).slot;
        int selfSlot = ((Expr.Register) call.args.get(0)).slot;
        if (fnSlot == selfSlot) return 0;
        StructuredNode consumer = nodes.get(consumerAt);
        if (TempFolding.countReads(consumer.exprs(), fnSlot) != 1
                || TempFolding.countReads(consumer.exprs(), selfSlot) != 1) {
            return 0;
        }
        int fnDef = -1, selfDef = -1;
        for (int k = consumerAt - 1; k >= 0 && (fnDef < 0 || selfDef < 0); k--) {
            StructuredNode node = nodes.get(k);
            Expr.Register def = Statements.registerDef(node);
            if (fnDef < 0 && def != null && def.slot == fnSlot && !names.isNamed(def)) {
                fnDef = k;
            } else if (selfDef < 0 && def != null && def.slot == selfSlot && !names.isNamed(def)) {
                selfDef = k;
            } else if (!(node instanceof ExprStatement)
                    || Statements.touches(node, fnSlot)
                    || Statements.touches(node, selfSlot)) {
                return 0;
            }
        }
        if (fnDef < 0 || selfDef < 0) return 0;

        Expr method = ((ExprStatement) nodes.get(fnDef)).values.get(0);
        Expr self = ((ExprStatement) nodes.get(selfDef)).values.get(0);
        if (!(method instanceof Expr.Index) || ((Expr.Index) method).stringKey() == null) return 0;
        Expr table = ((Expr.Index) method).table;
        if (!(table instanceof Expr.Register)) return 0;
        int tableSlot = ((Expr.Register) table).slot;
        if (tableSlot == selfSlot) {
            if (selfDef > fnDef) return 0;
        } else if (!Statements.isRegister(self, tableSlot)
                || fnDef < selfDef && tableSlot == fnSlot) {
            return 0;
        }
        if (!(self instanceof Expr.Register)) return 0;
        int objectSlot = ((Expr.Register) self).slot;
        for (int k = selfDef + 1; k < consumerAt; k++) {
            if (k != fnDef && Statements.writes(nodes.get(k), objectSlot)) return 0;
        }

        Expr.Call rewritten = new Expr.Call(
                new Expr.Index(self, ((Expr.Index) method).key),
                call.args.subList(1, call.args.size()),
                true);
        consumer.rewriteExprs(e -> e.rewrite(x -> x == call ? rewritten : x));
        nodes.remove(Math.max(fnDef, selfDef));
        nodes.remove(Math.min(fnDef, selfDef));
        return 2;
    }
}
