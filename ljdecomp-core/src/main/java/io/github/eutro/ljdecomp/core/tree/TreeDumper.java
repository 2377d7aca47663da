package io.github.eutro.ljdecomp.core.tree;

import io.github.eutro.ljdecomp.core.tree.StructuredNode.*;

import java.util.List;

/**
 * Renders a tree as indented Lua-like text, for logs and test failure messages.
 */
public class TreeDumper implements StructuredNode.Visitor<Void> {
    private final StringBuilder sb = new StringBuilder();
    private int depth;

    public static String dump(StructuredNode node) {
        TreeDumper dumper = new TreeDumper();
        node.accept(dumper);
        return dumper.sb.toString();
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        sb.append(text).append('\n');
    }

    private void nested(Sequence body) {
        depth++;
        body.accept(this);
        depth--;
    }

    private static String join(List<Expr> exprs) {
        StringBuilder sb = new StringBuilder();
        Expr.joinTo(sb, exprs);
        return sb.toString();
    }

    @Override
    public Void visitSequence(Sequence node) {
        for (StructuredNode child : node.nodes) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitIf(If node) {
        line("if " + node.cond + " then");
        nested(node.then);
        if (node.orElse != null) {
            line("else");
            nested(node.orElse);
        }
        line("end");
        return null;
    }

    @Override
    public Void visitWhile(While node) {
        line("while " + node.cond + " do");
        nested(node.body);
        line("end");
        return null;
    }

    @Override
    public Void visitRepeatUntil(RepeatUntil node) {
        line("repeat");
        nested(node.body);
        line("until " + node.cond);
        return null;
    }

    @Override
    public Void visitNumericFor(NumericFor node) {
        line("for " + node.variable + " = " + node.start + ", " + node.limit + ", " + node.step + " do");
        nested(node.body);
        line("end");
        return null;
    }

    @Override
    public Void visitGenericFor(GenericFor node) {
        line("for " + join(node.variables) + " in " + join(node.iterators) + " do");
        nested(node.body);
        line("end");
        return null;
    }

    @Override
    public Void visitBreak(Break node) {
        line("break");
        return null;
    }

    @Override
    public Void visitContinue(Continue node) {
        line("continue");
        return null;
    }

    @Override
    public Void visitReturn(Return node) {
        line(node.values.isEmpty() ? "return" : "return " + join(node.values));
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        if (node.targets.isEmpty()) {
            line(join(node.values));
        } else {
            line((node.localDeclaration ? "local " : "") + join(node.targets)
                    + (node.values.isEmpty() ? "" : " = " + join(node.values)));
        }
        return null;
    }

    @Override
    public Void visitBlock(Block node) {
        line("::" + node.label + "::");
        visitSequence(node.body);
        return null;
    }

    @Override
    public Void visitGoto(Goto node) {
        line("goto " + node.label);
        return null;
    }
}
