package io.github.eutro.ljdecomp.core.tree;

public enum UnOp {
    NOT("not "),
    NEG("-"),
    LEN("#"),
    ;

    public static final int PRECEDENCE = 7;

    public final String symbol;

    UnOp(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
