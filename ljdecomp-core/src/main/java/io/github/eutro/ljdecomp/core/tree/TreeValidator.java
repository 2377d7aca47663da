package io.github.eutro.ljdecomp.core.tree;

import io.github.eutro.ljdecomp.core.diag.DecompilationException;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks the invariants of a finished tree.
 */
public final class TreeValidator {
    private TreeValidator() {
    }

    /**
     * Check that {@code break} and {@code continue} only appear in loops,
     * and that every {@code goto} has a label to go to.
     *
     * @param root The tree.
     * @throws DecompilationException If a check fails.
     */
    public static void checkScoping(StructuredNode root) {
        Set<String> labels = new HashSet<>();
        Trees.forEachNode(root, node -> {
            if (node instanceof StructuredNode.Block) labels.add(((StructuredNode.Block) node).label);
        });
        checkScoping(root, 0, labels);
    }

    private static void checkScoping(StructuredNode node, int loopDepth, Set<String> labels) {
        switch (node.kind()) {
            case BREAK:
            case CONTINUE:
                if (loopDepth == 0) fail(node.kind().name().toLowerCase() + " outside of a loop");
                return;
            case GOTO:
                if (!labels.contains(((StructuredNode.Goto) node).label)) {
                    fail("goto to missing label " + ((StructuredNode.Goto) node).label);
                }
                return;
            default:
                break;
        }
        int depth = node.isLoop() ? loopDepth + 1 : loopDepth;
        for (StructuredNode child : node.children()) {
            checkScoping(child, depth, labels);
        }
    }

    /**
     * Check that no raw register or pending multiple-results read is left.
     *
     * @param root The tree.
     * @throws DecompilationException If a check fails.
     */
    public static void checkMaterialized(StructuredNode root) {
        Trees.forEachExpr(root, expr -> {
            if (expr instanceof Expr.Register) {
                fail("register " + expr + " was never named");
            } else if (expr instanceof Expr.MultRes) {
                fail("multiple results were never consumed");
            }
        });
        Trees.forEachNode(root, node -> {
            if (node instanceof StructuredNode.ExprStatement && ((StructuredNode.ExprStatement) node).spread) {
                fail("multiple results stored outside a table constructor");
            }
        });
    }

    public static void validate(StructuredNode root) {
        checkScoping(root);
        checkMaterialized(root);
    }

    private static void fail(String message) {
        throw new DecompilationException(DiagnosticKind.INTERNAL_ERROR, message);
    }
}
