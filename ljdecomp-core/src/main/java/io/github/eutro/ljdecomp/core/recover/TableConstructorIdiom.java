package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.bc.Primitive;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.Expr.TableConstructor;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Moves the constant-key stores that follow a table constructor into it.
 * <p>
 * The next positional index appends, a positional {@code nil} reserved by the template is
 * filled in, and a store of multiple results appends all of them and ends the constructor.
 */
final class TableConstructorIdiom extends SequenceRewrite {
    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (int i = 0; i < seq.nodes.size(); i++) {
            Expr.Register table = Statements.registerDef(seq.nodes.get(i));
            if (table == null) continue;
            ExprStatement def = (ExprStatement) seq.nodes.get(i);
            if (!(def.values.get(0) instanceof TableConstructor)) continue;
            TableConstructor constructor = (TableConstructor) def.values.get(0);
            int absorbed = 0;
            while (i + 1 + absorbed < seq.nodes.size()) {
                TableConstructor next = absorb(constructor, seq.nodes.get(i + 1 + absorbed), table.slot);
                if (next == null) break;
                constructor = next;
                absorbed++;
                if (isClosed(constructor)) break;
            }
            if (absorbed == 0) continue;
            def.values = Collections.singletonList(constructor);
            seq.nodes.subList(i + 1, i + 1 + absorbed).clear();
            changed = true;
        }
        return changed;
    }

    private static boolean isClosed(TableConstructor constructor) {
        List<TableConstructor.Entry> entries = constructor.entries;
        if (entries.isEmpty()) return false;
        TableConstructor.Entry last = entries.get(entries.size() - 1);
        return last.key == null && last.value.isMultiValued();
    }

    private static @Nullable TableConstructor absorb(TableConstructor constructor, Object node, int slot) {
        if (!(node instanceof ExprStatement)) return null;
        ExprStatement store = (ExprStatement) node;
        if (store.targets.size() != 1 || store.values.size() != 1 || store.localDeclaration) return null;
        if (!(store.targets.get(0) instanceof Expr.Index)) return null;
        Expr.Index target = (Expr.Index) store.targets.get(0);
        Expr value = store.values.get(0);
        if (!Statements.isRegister(target.table, slot)
                || !(target.key instanceof Expr.Constant)
                || Statements.countReads(value, slot) != 0) {
            return null;
        }
        Object key = ((Expr.Constant) target.key).value;
        if (key == Primitive.NIL) return null;
        List<TableConstructor.Entry> entries = new ArrayList<>(constructor.entries);
        int positional = 0;
        for (TableConstructor.Entry entry : entries) {
            if (entry.key == null) positional++;
        }
        Integer index = integerKey(key);
        for (TableConstructor.Entry entry : entries) {
            if (entry.key instanceof Expr.Constant && sameKey(((Expr.Constant) entry.key).value, key)) return null;
        }
        if (store.spread) {
            if (index == null || index != positional + 1) return null;
            entries.add(new TableConstructor.Entry(null, value));
            return new TableConstructor(entries);
        }
        if (index != null && index >= 1 && index <= positional) {
            int seen = 0;
            for (int k = 0; k < entries.size(); k++) {
                TableConstructor.Entry entry = entries.get(k);
                if (entry.key != null || ++seen != index) continue;
                if (!isNil(entry.value)) return null;
                entries.set(k, new TableConstructor.Entry(null, value));
                return new TableConstructor(entries);
            }
            return null;
        }
        if (index != null && index == positional + 1 && !value.isMultiValued()) {
            entries.add(new TableConstructor.Entry(null, value));
            return new TableConstructor(entries);
        }
        entries.add(new TableConstructor.Entry(target.key, value));
        return new TableConstructor(entries);
    }

    private static boolean isNil(Expr expr) {
        return expr instanceof Expr.Constant && ((Expr.Constant) expr).value == Primitive.NIL;
    }

    static @Nullable Integer integerKey(Object key) {
        if (key instanceof Integer) return (Integer) key;
        if (key instanceof Double) {
            double d = (Double) key;
            if (d == Math.rint(d) && Math.abs(d) < Integer.MAX_VALUE) return (int) d;
        }
        return null;
    }

    private static boolean sameKey(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return a.equals(b);
    }
}
