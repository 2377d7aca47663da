package io.github.eutro.ljdecomp.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * A statement of the recovered source.
 * <p>
 * Nodes are mutable, so recovery passes can rewrite the tree in place.
 */
public abstract class StructuredNode {
    public enum Kind {
        SEQUENCE,
        IF,
        WHILE,
        REPEAT_UNTIL,
        NUMERIC_FOR,
        GENERIC_FOR,
        BREAK,
        CONTINUE,
        RETURN,
        EXPR_STATEMENT,
        BLOCK,
        GOTO,
    }

    public interface Visitor<R> {
        R visitSequence(Sequence node);

        R visitIf(If node);

        R visitWhile(While node);

        R visitRepeatUntil(RepeatUntil node);

        R visitNumericFor(NumericFor node);

        R visitGenericFor(GenericFor node);

        R visitBreak(Break node);

        R visitContinue(Continue node);

        R visitReturn(Return node);

        R visitExprStatement(ExprStatement node);

        R visitBlock(Block node);

        R visitGoto(Goto node);
    }

    public abstract Kind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * @return The directly nested statements: a sequence's elements, or the bodies of a compound statement.
     */
    public List<StructuredNode> children() {
        return Collections.emptyList();
    }

    /**
     * @return The expressions of this statement itself, in evaluation order.
     */
    public List<Expr> exprs() {
        return Collections.emptyList();
    }

    /**
     * Replace each expression of this statement itself by the result of {@code f}.
     *
     * @param f The replacement.
     */
    public void rewriteExprs(UnaryOperator<Expr> f) {
    }

    public boolean isLoop() {
        return false;
    }

    @Override
    public String toString() {
        return TreeDumper.dump(this);
    }

    static List<Expr> rewriteAll(List<Expr> exprs, UnaryOperator<Expr> f) {
        List<Expr> result = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            result.add(f.apply(expr));
        }
        return result;
    }

    public static final class Sequence extends StructuredNode {
        public final List<StructuredNode> nodes = new ArrayList<>();

        public Sequence(StructuredNode... nodes) {
            for (StructuredNode node : nodes) {
                append(node);
            }
        }

        /**
         * Append a node, splicing in the elements of a sequence.
         *
         * @param node The node.
         * @return This sequence.
         */
        public Sequence append(StructuredNode node) {
            if (node instanceof Sequence) {
                nodes.addAll(((Sequence) node).nodes);
            } else {
                nodes.add(node);
            }
            return this;
        }

        public boolean isEmpty() {
            return nodes.isEmpty();
        }

        public @Nullable StructuredNode last() {
            return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }

        @Override
        public List<StructuredNode> children() {
            return nodes;
        }
    }

    public static final class If extends StructuredNode {
        public Expr cond;
        public Sequence then;
        public @Nullable Sequence orElse;

        public If(Expr cond, Sequence then, @Nullable Sequence orElse) {
            this.cond = cond;
            this.then = then;
            this.orElse = orElse;
        }

        @Override
        public Kind kind() {
            return Kind.IF;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public List<StructuredNode> children() {
            return orElse == null ? Collections.singletonList(then) : Arrays.asList(then, orElse);
        }

        @Override
        public List<Expr> exprs() {
            return Collections.singletonList(cond);
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            cond = f.apply(cond);
        }
    }

    public static final class While extends StructuredNode {
        public Expr cond;
        public Sequence body;

        public While(Expr cond, Sequence body) {
            this.cond = cond;
            this.body = body;
        }

        @Override
        public Kind kind() {
            return Kind.WHILE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }

        @Override
        public List<StructuredNode> children() {
            return Collections.singletonList(body);
        }

        @Override
        public List<Expr> exprs() {
            return Collections.singletonList(cond);
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            cond = f.apply(cond);
        }

        @Override
        public boolean isLoop() {
            return true;
        }
    }

    public static final class RepeatUntil extends StructuredNode {
        public Sequence body;
        public Expr cond;

        public RepeatUntil(Sequence body, Expr cond) {
            this.body = body;
            this.cond = cond;
        }

        @Override
        public Kind kind() {
            return Kind.REPEAT_UNTIL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeatUntil(this);
        }

        @Override
        public List<StructuredNode> children() {
            return Collections.singletonList(body);
        }

        @Override
        public List<Expr> exprs() {
            return Collections.singletonList(cond);
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            cond = f.apply(cond);
        }

        @Override
        public boolean isLoop() {
            return true;
        }
    }

    public static final class NumericFor extends StructuredNode {
        /**
         * The loop variable, a copy of the hidden index.
         */
        public Expr variable;
        public Expr start, limit, step;
        public Sequence body;

        public NumericFor(Expr variable, Expr start, Expr limit, Expr step, Sequence body) {
            this.variable = variable;
            this.start = start;
            this.limit = limit;
            this.step = step;
            this.body = body;
        }

        @Override
        public Kind kind() {
            return Kind.NUMERIC_FOR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumericFor(this);
        }

        @Override
        public List<StructuredNode> children() {
            return Collections.singletonList(body);
        }

        /**
         * @return The start, limit and step, not the loop variable.
         */
        @Override
        public List<Expr> exprs() {
            return Arrays.asList(start, limit, step);
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            start = f.apply(start);
            limit = f.apply(limit);
            step = f.apply(step);
        }

        @Override
        public boolean isLoop() {
            return true;
        }
    }

    public static final class GenericFor extends StructuredNode {
        public List<Expr> variables;
        /**
         * The generator, state and control expressions, or fewer once collapsed into one call.
         */
        public List<Expr> iterators;
        public Sequence body;

        public GenericFor(List<Expr> variables, List<Expr> iterators, Sequence body) {
            this.variables = new ArrayList<>(variables);
            this.iterators = new ArrayList<>(iterators);
            this.body = body;
        }

        @Override
        public Kind kind() {
            return Kind.GENERIC_FOR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGenericFor(this);
        }

        @Override
        public List<StructuredNode> children() {
            return Collections.singletonList(body);
        }

        @Override
        public List<Expr> exprs() {
            return iterators;
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            iterators = rewriteAll(iterators, f);
        }

        @Override
        public boolean isLoop() {
            return true;
        }
    }

    public static final class Break extends StructuredNode {
        @Override
        public Kind kind() {
            return Kind.BREAK;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    public static final class Continue extends StructuredNode {
        @Override
        public Kind kind() {
            return Kind.CONTINUE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    public static final class Return extends StructuredNode {
        public List<Expr> values;
        public final int pc;

        public Return(List<Expr> values, int pc) {
            this.values = new ArrayList<>(values);
            this.pc = pc;
        }

        @Override
        public Kind kind() {
            return Kind.RETURN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public List<Expr> exprs() {
            return values;
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            values = rewriteAll(values, f);
        }
    }

    /**
     * An assignment, or a call statement when there are no targets.
     */
    public static final class ExprStatement extends StructuredNode {
        public List<Expr> targets;
        public List<Expr> values;
        public boolean localDeclaration;
        /**
         * Whether this stores every value of its last expression, at consecutive keys from the target's.
         * Only a table constructor can express that.
         */
        public boolean spread;
        public final int pc;

        public ExprStatement(List<Expr> targets, List<Expr> values, int pc) {
            this.targets = new ArrayList<>(targets);
            this.values = new ArrayList<>(values);
            this.pc = pc;
        }

        public static ExprStatement assign(Expr target, Expr value, int pc) {
            return new ExprStatement(Collections.singletonList(target), Collections.singletonList(value), pc);
        }

        public boolean isCall() {
            return targets.isEmpty() && values.size() == 1 && values.get(0) instanceof Expr.Call;
        }

        @Override
        public Kind kind() {
            return Kind.EXPR_STATEMENT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExprStatement(this);
        }

        /**
         * @return The indexed targets, then the values; plain targets are not reads.
         */
        @Override
        public List<Expr> exprs() {
            List<Expr> exprs = new ArrayList<>();
            for (Expr target : targets) {
                if (target instanceof Expr.Index) exprs.add(target);
            }
            exprs.addAll(values);
            return exprs;
        }

        @Override
        public void rewriteExprs(UnaryOperator<Expr> f) {
            List<Expr> newTargets = new ArrayList<>(targets.size());
            for (Expr target : targets) {
                newTargets.add(target instanceof Expr.Index ? f.apply(target) : target);
            }
            targets = newTargets;
            values = rewriteAll(values, f);
        }
    }

    /**
     * A labeled block, the target of {@link Goto}s in control flow that has no structured form.
     */
    public static final class Block extends StructuredNode {
        public final String label;
        public Sequence body;

        public Block(String label, Sequence body) {
            this.label = label;
            this.body = body;
        }

        @Override
        public Kind kind() {
            return Kind.BLOCK;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public List<StructuredNode> children() {
            return Collections.singletonList(body);
        }
    }

    public static final class Goto extends StructuredNode {
        public final String label;

        public Goto(String label) {
            this.label = label;
        }

        @Override
        public Kind kind() {
            return Kind.GOTO;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGoto(this);
        }
    }
}
