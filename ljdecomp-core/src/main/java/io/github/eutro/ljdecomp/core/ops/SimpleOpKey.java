package io.github.eutro.ljdecomp.core.ops;

/**
 * A key with no immediate argument, and so exactly one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }

    public boolean is(Op op) {
        return op.key == this;
    }
}
