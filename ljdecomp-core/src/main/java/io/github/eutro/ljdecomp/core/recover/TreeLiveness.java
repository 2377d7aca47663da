package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.*;
import io.github.eutro.ljdecomp.core.tree.Trees;

import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backward register liveness over a structured tree, by slot.
 * <p>
 * A {@code goto} may go anywhere, so every slot is live before one.
 */
public final class TreeLiveness {
    private final Map<StructuredNode, BitSet> liveIn = new IdentityHashMap<>();
    private final Map<StructuredNode, BitSet> liveOut = new IdentityHashMap<>();
    private final BitSet all = new BitSet();

    private TreeLiveness() {
    }

    public static TreeLiveness compute(StructuredNode root) {
        TreeLiveness liveness = new TreeLiveness();
        Trees.forEachExpr(root, e -> {
            if (e instanceof Expr.Register) liveness.all.set(((Expr.Register) e).slot);
        });
        liveness.visit(root, new BitSet(), null, null);
        return liveness;
    }

    /**
     * @param node A statement.
     * @return The slots read after it before being written.
     */
    public BitSet liveOut(StructuredNode node) {
        BitSet set = liveOut.get(node);
        return set == null ? (BitSet) all.clone() : set;
    }

    public BitSet liveIn(StructuredNode node) {
        BitSet set = liveIn.get(node);
        return set == null ? (BitSet) all.clone() : set;
    }

    static void uses(List<Expr> exprs, BitSet into) {
        for (Expr expr : exprs) {
            expr.forEach(e -> {
                if (e instanceof Expr.Register) into.set(((Expr.Register) e).slot);
            });
        }
    }

    private BitSet visit(StructuredNode node, BitSet out, BitSet breakTo, BitSet continueTo) {
        liveOut.put(node, (BitSet) out.clone());
        BitSet in;
        switch (node.kind()) {
            case SEQUENCE: {
                List<StructuredNode> nodes = ((Sequence) node).nodes;
                BitSet live = out;
                for (int i = nodes.size() - 1; i >= 0; i--) {
                    live = visit(nodes.get(i), live, breakTo, continueTo);
                }
                in = (BitSet) live.clone();
                break;
            }
            case EXPR_STATEMENT: {
                ExprStatement stmt = (ExprStatement) node;
                in = (BitSet) out.clone();
                for (Expr target : stmt.targets) {
                    if (target instanceof Expr.Register) in.clear(((Expr.Register) target).slot);
                }
                uses(stmt.exprs(), in);
                break;
            }
            case RETURN:
                in = new BitSet();
                uses(node.exprs(), in);
                break;
            case BREAK:
                in = breakTo == null ? new BitSet() : (BitSet) breakTo.clone();
                break;
            case CONTINUE:
                in = continueTo == null ? new BitSet() : (BitSet) continueTo.clone();
                break;
            case GOTO:
                in = (BitSet) all.clone();
                break;
            case BLOCK:
                in = visit(((Block) node).body, out, breakTo, continueTo);
                break;
            case IF: {
                If anIf = (If) node;
                in = visit(anIf.then, out, breakTo, continueTo);
                in.or(anIf.orElse == null ? out : visit(anIf.orElse, out, breakTo, continueTo));
                uses(anIf.exprs(), in);
                break;
            }
            case WHILE: {
                While loop = (While) node;
                BitSet head = (BitSet) out.clone();
                uses(loop.exprs(), head);
                while (true) {
                    BitSet next = visit(loop.body, head, out, head);
                    next.or(out);
                    uses(loop.exprs(), next);
                    if (next.equals(head)) break;
                    head = next;
                }
                in = head;
                break;
            }
            case REPEAT_UNTIL: {
                RepeatUntil loop = (RepeatUntil) node;
                BitSet test = (BitSet) out.clone();
                uses(loop.exprs(), test);
                BitSet bodyIn;
                while (true) {
                    bodyIn = visit(loop.body, test, out, test);
                    BitSet next = (BitSet) out.clone();
                    next.or(bodyIn);
                    uses(loop.exprs(), next);
                    if (next.equals(test)) break;
                    test = next;
                }
                in = bodyIn;
                break;
            }
            case NUMERIC_FOR:
            case GENERIC_FOR: {
                List<Expr> variables = node instanceof NumericFor
                        ? java.util.Collections.singletonList(((NumericFor) node).variable)
                        : ((GenericFor) node).variables;
                Sequence body = node instanceof NumericFor ? ((NumericFor) node).body : ((GenericFor) node).body;
                BitSet head = (BitSet) out.clone();
                while (true) {
                    BitSet next = visit(body, head, out, head);
                    for (Expr variable : variables) {
                        if (variable instanceof Expr.Register) next.clear(((Expr.Register) variable).slot);
                    }
                    next.or(out);
                    if (next.equals(head)) break;
                    head = next;
                }
                in = (BitSet) head.clone();
                uses(node.exprs(), in);
                break;
            }
            default:
                in = (BitSet) out.clone();
                break;
        }
        liveIn.put(node, in);
        return (BitSet) in.clone();
    }
}
