package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.Trees;
import org.jetbrains.annotations.Nullable;

/**
 * Shapes of statements the recovery rules look for.
 */
final class Statements {
    private Statements() {
    }

    /**
     * @return The node if it is a plain single assignment, otherwise null.
     */
    static @Nullable ExprStatement single(StructuredNode node) {
        if (!(node instanceof ExprStatement)) return null;
        ExprStatement stmt = (ExprStatement) node;
        if (stmt.targets.size() != 1 || stmt.values.size() != 1 || stmt.spread || stmt.localDeclaration) return null;
        return stmt;
    }

    /**
     * @return The register a plain single assignment writes, otherwise null.
     */
    static @Nullable Expr.Register registerDef(StructuredNode node) {
        ExprStatement stmt = single(node);
        if (stmt == null || !(stmt.targets.get(0) instanceof Expr.Register)) return null;
        return (Expr.Register) stmt.targets.get(0);
    }

    static boolean isRegister(@Nullable Expr expr, int slot) {
        return expr instanceof Expr.Register && ((Expr.Register) expr).slot == slot;
    }

    /**
     * Count the reads of a slot anywhere under a node.
     */
    static int countReads(StructuredNode root, int slot) {
        int[] count = {0};
        Trees.forEachNode(root, node -> {
            for (Expr expr : node.exprs()) {
                count[0] += countReads(expr, slot);
            }
        });
        return count[0];
    }

    static int countReads(Expr expr, int slot) {
        int[] count = {0};
        expr.forEach(e -> {
            if (isRegister(e, slot)) count[0]++;
        });
        return count[0];
    }

    /**
     * @return Whether anything under the node reads or writes the slot.
     */
    static boolean touches(StructuredNode root, int slot) {
        boolean[] found = {false};
        Trees.forEachExpr(root, e -> {
            if (isRegister(e, slot)) found[0] = true;
        });
        return found[0];
    }

    /**
     * @return Whether the node assigns the slot directly.
     */
    static boolean writes(StructuredNode node, int slot) {
        if (!(node instanceof ExprStatement)) return false;
        for (Expr target : ((ExprStatement) node).targets) {
            if (isRegister(target, slot)) return true;
        }
        return false;
    }
}
