package io.github.eutro.ljdecomp.core.bc;

/**
 * The primitive constants, in the order of their {@link OperandMode#PRI} encoding.
 */
public enum Primitive {
    NIL("nil"),
    FALSE("false"),
    TRUE("true"),
    ;

    public final String source;

    Primitive(String source) {
        this.source = source;
    }

    public static Primitive of(boolean b) {
        return b ? TRUE : FALSE;
    }

    @Override
    public String toString() {
        return source;
    }
}
