package io.github.eutro.ljdecomp.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key whose operations carry one immediate argument.
 *
 * @param <T> The argument type.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        return new UnaryOp(Objects.requireNonNull(arg, "arg"));
    }

    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op op) {
        return op.key == this ? (UnaryOp) op : null;
    }

    public Optional<UnaryOp> check(Op op) {
        return Optional.ofNullable(checkNullable(op));
    }

    public UnaryOp cast(Op op) {
        UnaryOp ret = checkNullable(op);
        if (ret == null) throw new ClassCastException(op + " is not " + this);
        return ret;
    }

    public @Nullable T argNullable(Op op) {
        UnaryOp ret = checkNullable(op);
        return ret == null ? null : ret.arg;
    }
}
