package io.github.eutro.ljdecomp.core.tree;

import java.util.*;
import java.util.function.Predicate;

/**
 * Substitutes a run of register assignments into the expressions that consume them.
 * <p>
 * The assignments run in order, so each substituted value must be read after
 * every earlier one; a read in the right operand of {@code and}/{@code or} is
 * not always evaluated, so it is never substituted.
 */
public final class TempFolding {
    private TempFolding() {
    }

    /**
     * One assignment {@code r[slot] = value}.
     */
    public static final class Def {
        public final int slot;
        public final Expr value;

        public Def(int slot, Expr value) {
            this.slot = slot;
            this.value = value;
        }
    }

    private static final class Read {
        final Expr.Register register;
        final boolean conditional;
        final boolean expands;

        Read(Expr.Register register, boolean conditional, boolean expands) {
            this.register = register;
            this.conditional = conditional;
            this.expands = expands;
        }
    }

    /**
     * Fold as many of the assignments as possible, last first.
     *
     * @param defs     The assignments, in execution order.
     * @param consumer The expressions reading them, in evaluation order. Rewritten in place.
     * @return How many assignments, counted from the end of {@code defs}, were folded.
     */
    public static int fold(List<Def> defs, List<Expr> consumer) {
        return fold(defs, consumer, false, r -> true);
    }

    /**
     * Fold as many of the assignments as possible, last first.
     * <p>
     * A value with multiple results is not substituted where all of them would be used,
     * since the assignment kept only the first.
     *
     * @param defs          The assignments, in execution order.
     * @param consumer      The expressions reading them, in evaluation order. Rewritten in place.
     * @param lastExpands   Whether the consumer uses every result of its last expression.
     * @param substitutable Which reads may be replaced.
     * @return How many assignments, counted from the end of {@code defs}, were folded.
     */
    public static int fold(List<Def> defs, List<Expr> consumer, boolean lastExpands,
                           Predicate<Expr.Register> substitutable) {
        int folded = 0;
        for (int j = defs.size() - 1; j >= 0; j--) {
            Def def = defs.get(j);
            Set<Integer> pending = new HashSet<>();
            for (int i = 0; i <= j; i++) {
                pending.add(defs.get(i).slot);
            }
            List<Read> reads = new ArrayList<>();
            for (int i = 0; i < consumer.size(); i++) {
                collect(consumer.get(i), false, lastExpands && i == consumer.size() - 1, pending, reads);
            }
            Read only = null;
            int count = 0;
            for (Read read : reads) {
                if (read.register.slot == def.slot) {
                    only = read;
                    count++;
                }
            }
            if (count != 1
                    || only.conditional
                    || reads.get(reads.size() - 1) != only
                    || only.expands && def.value.isMultiValued()
                    || !substitutable.test(only.register)) {
                break;
            }
            Expr.Register target = only.register;
            consumer.replaceAll(e -> e.rewrite(x -> x == target ? def.value : x));
            folded++;
        }
        return folded;
    }

    /**
     * Count the reads of a slot.
     *
     * @param exprs The expressions.
     * @param slot  The slot.
     * @return The number of {@link Expr.Register}s of that slot.
     */
    public static int countReads(Collection<Expr> exprs, int slot) {
        int[] count = {0};
        for (Expr expr : exprs) {
            expr.forEach(e -> {
                if (e instanceof Expr.Register && ((Expr.Register) e).slot == slot) count[0]++;
            });
        }
        return count[0];
    }

    private static void collect(Expr expr, boolean conditional, boolean expands, Set<Integer> slots, List<Read> reads) {
        if (expr instanceof Expr.Register) {
            if (slots.contains(((Expr.Register) expr).slot)) {
                reads.add(new Read((Expr.Register) expr, conditional, expands));
            }
            return;
        }
        if (expr instanceof Expr.Binary) {
            Expr.Binary bin = (Expr.Binary) expr;
            collect(bin.lhs, conditional, false, slots, reads);
            collect(bin.rhs, conditional || bin.op == BinOp.AND || bin.op == BinOp.OR, false, slots, reads);
            return;
        }
        if (expr instanceof Expr.Call) {
            Expr.Call call = (Expr.Call) expr;
            collect(call.function, conditional, false, slots, reads);
            for (int i = 0; i < call.args.size(); i++) {
                collect(call.args.get(i), conditional, i == call.args.size() - 1, slots, reads);
            }
            return;
        }
        if (expr instanceof Expr.TableConstructor) {
            List<Expr.TableConstructor.Entry> entries = ((Expr.TableConstructor) expr).entries;
            for (int i = 0; i < entries.size(); i++) {
                Expr.TableConstructor.Entry entry = entries.get(i);
                if (entry.key != null) collect(entry.key, conditional, false, slots, reads);
                collect(entry.value, conditional, entry.key == null && i == entries.size() - 1, slots, reads);
            }
            return;
        }
        for (Expr child : expr.children()) {
            collect(child, conditional, false, slots, reads);
        }
    }
}
