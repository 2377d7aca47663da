package io.github.eutro.ljdecomp.core.tree;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.Primitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * An expression of the recovered source.
 * <p>
 * Expressions are immutable, and compare by identity: two reads of the same
 * register are different {@link Register}s.
 */
public abstract class Expr {
    public enum Kind {
        CONSTANT,
        REGISTER,
        LOCAL,
        UPVALUE,
        GLOBAL,
        INDEX,
        VARARG,
        CALL,
        BINARY,
        UNARY,
        CLOSURE,
        TABLE_CONSTRUCTOR,
        MULTRES,
    }

    public interface Visitor<R> {
        R visitConstant(Constant expr);

        R visitRegister(Register expr);

        R visitLocal(Local expr);

        R visitUpvalue(Upvalue expr);

        R visitGlobal(Global expr);

        R visitIndex(Index expr);

        R visitVararg(Vararg expr);

        R visitCall(Call expr);

        R visitBinary(Binary expr);

        R visitUnary(Unary expr);

        R visitClosure(Closure expr);

        R visitTableConstructor(TableConstructor expr);

        R visitMultRes(MultRes expr);
    }

    public abstract Kind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * @return The direct subexpressions, in evaluation order.
     */
    public List<Expr> children() {
        return Collections.emptyList();
    }

    /**
     * Rebuild this expression with new children, in the order of {@link #children()}.
     *
     * @param children The new children.
     * @return The rebuilt expression.
     */
    protected Expr withChildren(List<Expr> children) {
        return this;
    }

    /**
     * Rewrite this expression bottom-up.
     *
     * @param f The rewrite, applied to every node after its children.
     * @return The rewritten expression, this if nothing changed.
     */
    public Expr rewrite(UnaryOperator<Expr> f) {
        List<Expr> children = children();
        Expr rebuilt = this;
        if (!children.isEmpty()) {
            List<Expr> newChildren = new ArrayList<>(children.size());
            boolean changed = false;
            for (Expr child : children) {
                Expr newChild = child.rewrite(f);
                changed |= newChild != child;
                newChildren.add(newChild);
            }
            if (changed) rebuilt = withChildren(newChildren);
        }
        return f.apply(rebuilt);
    }

    /**
     * Visit this expression and its subexpressions, parents before children.
     *
     * @param action The action.
     */
    public void forEach(Consumer<Expr> action) {
        action.accept(this);
        for (Expr child : children()) {
            child.forEach(action);
        }
    }

    /**
     * @return Whether this expression can produce any number of values.
     */
    public boolean isMultiValued() {
        return false;
    }

    /**
     * @return The precedence a printer parenthesizes this expression by.
     */
    public int precedence() {
        return Integer.MAX_VALUE;
    }

    public static final class Constant extends Expr {
        /**
         * A {@link Primitive}, {@link String}, {@link Integer}, {@link Double}
         * or {@link io.github.eutro.ljdecomp.core.bc.CDataConstant}.
         */
        public final Object value;

        public Constant(Object value) {
            this.value = Objects.requireNonNull(value);
        }

        public static Constant of(boolean b) {
            return new Constant(Primitive.of(b));
        }

        public boolean isTrue() {
            return value == Primitive.TRUE;
        }

        public boolean isFalse() {
            return value == Primitive.FALSE;
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public String toString() {
            if (value instanceof String) return quote((String) value);
            if (value instanceof Double) {
                double d = (Double) value;
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                if (Double.isNaN(d)) return "0/0";
                if (Double.isInfinite(d)) return d > 0 ? "math.huge" : "-math.huge";
            }
            return String.valueOf(value);
        }

        static String quote(String s) {
            StringBuilder sb = new StringBuilder("\"");
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"':
                        sb.append("\\\"");
                        break;
                    case '\\':
                        sb.append("\\\\");
                        break;
                    case '\n':
                        sb.append("\\n");
                        break;
                    case '\r':
                        sb.append("\\r");
                        break;
                    case '\t':
                        sb.append("\\t");
                        break;
                    default:
                        if (c < 0x20 || c == 0x7f) {
                            sb.append('\\').append((int) c);
                        } else {
                            sb.append(c);
                        }
                }
            }
            return sb.append('"').toString();
        }
    }

    /**
     * A raw read or write of a register slot, before names are resolved.
     */
    public static final class Register extends Expr {
        public final int slot;
        /**
         * The offset of the instruction that reads or writes the slot.
         */
        public final int pc;

        public Register(int slot, int pc) {
            this.slot = slot;
            this.pc = pc;
        }

        @Override
        public Kind kind() {
            return Kind.REGISTER;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRegister(this);
        }

        @Override
        public String toString() {
            return "r" + slot;
        }
    }

    public static final class Local extends Expr {
        public final String name;
        public final int slot;

        public Local(String name, int slot) {
            this.name = name;
            this.slot = slot;
        }

        @Override
        public Kind kind() {
            return Kind.LOCAL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocal(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Upvalue extends Expr {
        public final int index;
        public final String name;

        public Upvalue(int index, String name) {
            this.index = index;
            this.name = name;
        }

        @Override
        public Kind kind() {
            return Kind.UPVALUE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpvalue(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Global extends Expr {
        public final String name;

        public Global(String name) {
            this.name = name;
        }

        @Override
        public Kind kind() {
            return Kind.GLOBAL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlobal(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Index extends Expr {
        public final Expr table;
        public final Expr key;

        public Index(Expr table, Expr key) {
            this.table = table;
            this.key = key;
        }

        /**
         * @return The key if it is a string constant, so the index can be written {@code t.name}.
         */
        public @Nullable String stringKey() {
            if (key instanceof Constant && ((Constant) key).value instanceof String) {
                return (String) ((Constant) key).value;
            }
            return null;
        }

        @Override
        public Kind kind() {
            return Kind.INDEX;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }

        @Override
        public List<Expr> children() {
            return Arrays.asList(table, key);
        }

        @Override
        protected Expr withChildren(List<Expr> children) {
            return new Index(children.get(0), children.get(1));
        }

        @Override
        public String toString() {
            String name = stringKey();
            return name != null && isIdentifier(name) ? table + "." + name : table + "[" + key + "]";
        }
    }

    public static final class Vararg extends Expr {
        @Override
        public Kind kind() {
            return Kind.VARARG;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVararg(this);
        }

        @Override
        public boolean isMultiValued() {
            return true;
        }

        @Override
        public String toString() {
            return "...";
        }
    }

    public static final class Call extends Expr {
        /**
         * The called function. For a method call, an {@link Index} with a string key
         * whose table is passed as the implicit first argument.
         */
        public final Expr function;
        public final List<Expr> args;
        public final boolean method;

        public Call(Expr function, List<Expr> args, boolean method) {
            this.function = function;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.method = method;
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(args.size() + 1);
            children.add(function);
            children.addAll(args);
            return children;
        }

        @Override
        protected Expr withChildren(List<Expr> children) {
            return new Call(children.get(0), children.subList(1, children.size()), method);
        }

        @Override
        public boolean isMultiValued() {
            return true;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (method) {
                Index idx = (Index) function;
                sb.append(idx.table).append(':').append(idx.stringKey());
            } else {
                sb.append(function);
            }
            sb.append('(');
            joinTo(sb, args);
            return sb.append(')').toString();
        }
    }

    public static final class Binary extends Expr {
        public final BinOp op;
        public final Expr lhs, rhs;

        public Binary(BinOp op, Expr lhs, Expr rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public List<Expr> children() {
            return Arrays.asList(lhs, rhs);
        }

        @Override
        protected Expr withChildren(List<Expr> children) {
            return new Binary(op, children.get(0), children.get(1));
        }

        @Override
        public int precedence() {
            return op.precedence;
        }

        @Override
        public String toString() {
            boolean parenL = lhs.precedence() < op.precedence
                    || lhs.precedence() == op.precedence && op.rightAssociative;
            boolean parenR = rhs.precedence() < op.precedence
                    || rhs.precedence() == op.precedence && !op.rightAssociative;
            return wrap(lhs, parenL) + " " + op + " " + wrap(rhs, parenR);
        }
    }

    public static final class Unary extends Expr {
        public final UnOp op;
        public final Expr operand;

        public Unary(UnOp op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public Kind kind() {
            return Kind.UNARY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(operand);
        }

        @Override
        protected Expr withChildren(List<Expr> children) {
            return new Unary(op, children.get(0));
        }

        @Override
        public int precedence() {
            return UnOp.PRECEDENCE;
        }

        @Override
        public String toString() {
            return op.symbol + wrap(operand, operand.precedence() < UnOp.PRECEDENCE);
        }
    }

    /**
     * A function expression; the body is the child prototype.
     */
    public static final class Closure extends Expr {
        public final BytecodeFunction function;

        public Closure(BytecodeFunction function) {
            this.function = function;
        }

        @Override
        public Kind kind() {
            return Kind.CLOSURE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClosure(this);
        }

        @Override
        public String toString() {
            return "function#" + function.index;
        }
    }

    public static final class TableConstructor extends Expr {
        public static final class Entry {
            /**
             * The key, or null for a positional entry.
             */
            public final @Nullable Expr key;
            public final Expr value;

            public Entry(@Nullable Expr key, Expr value) {
                this.key = key;
                this.value = value;
            }

            @Override
            public String toString() {
                if (key == null) return value.toString();
                if (key instanceof Constant && ((Constant) key).value instanceof String
                        && isIdentifier((String) ((Constant) key).value)) {
                    return ((Constant) key).value + " = " + value;
                }
                return "[" + key + "] = " + value;
            }
        }

        public final List<Entry> entries;

        public TableConstructor(List<Entry> entries) {
            this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        }

        public TableConstructor with(Entry entry) {
            List<Entry> entries = new ArrayList<>(this.entries);
            entries.add(entry);
            return new TableConstructor(entries);
        }

        @Override
        public Kind kind() {
            return Kind.TABLE_CONSTRUCTOR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTableConstructor(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            for (Entry entry : entries) {
                if (entry.key != null) children.add(entry.key);
                children.add(entry.value);
            }
            return children;
        }

        @Override
        protected Expr withChildren(List<Expr> children) {
            List<Entry> newEntries = new ArrayList<>(entries.size());
            Iterator<Expr> it = children.iterator();
            for (Entry entry : entries) {
                Expr key = entry.key == null ? null : it.next();
                newEntries.add(new Entry(key, it.next()));
            }
            return new TableConstructor(newEntries);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            joinTo(sb, entries);
            return sb.append('}').toString();
        }
    }

    /**
     * All the results of the previous call or vararg, before they are inlined into their consumer.
     */
    public static final class MultRes extends Expr {
        @Override
        public Kind kind() {
            return Kind.MULTRES;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMultRes(this);
        }

        @Override
        public boolean isMultiValued() {
            return true;
        }

        @Override
        public String toString() {
            return "MULTRES";
        }
    }

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto", "if", "in",
            "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while"));

    public static boolean isIdentifier(@NotNull String s) {
        if (s.isEmpty() || KEYWORDS.contains(s) || Character.isDigit(s.charAt(0))) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(c == '_' || c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9')) {
                return false;
            }
        }
        return true;
    }

    static String wrap(Expr e, boolean paren) {
        return paren ? "(" + e + ")" : e.toString();
    }

    static void joinTo(StringBuilder sb, List<?> items) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i));
        }
    }
}
