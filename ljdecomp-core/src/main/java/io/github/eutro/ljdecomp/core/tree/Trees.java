package io.github.eutro.ljdecomp.core.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Walks over trees.
 */
public final class Trees {
    private Trees() {
    }

    /**
     * Visit every statement, parents before children, in source order.
     *
     * @param root   The root.
     * @param action The action.
     */
    public static void forEachNode(StructuredNode root, Consumer<StructuredNode> action) {
        Deque<StructuredNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            StructuredNode node = stack.pop();
            action.accept(node);
            List<StructuredNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Visit every expression of every statement, including assignment targets and loop variables.
     *
     * @param root   The root.
     * @param action The action, called for subexpressions too.
     */
    public static void forEachExpr(StructuredNode root, Consumer<Expr> action) {
        forEachNode(root, node -> {
            switch (node.kind()) {
                case EXPR_STATEMENT:
                    for (Expr target : ((StructuredNode.ExprStatement) node).targets) {
                        if (!(target instanceof Expr.Index)) target.forEach(action);
                    }
                    break;
                case NUMERIC_FOR:
                    ((StructuredNode.NumericFor) node).variable.forEach(action);
                    break;
                case GENERIC_FOR:
                    for (Expr variable : ((StructuredNode.GenericFor) node).variables) {
                        variable.forEach(action);
                    }
                    break;
                default:
                    break;
            }
            for (Expr expr : node.exprs()) {
                expr.forEach(action);
            }
        });
    }
}
