package io.github.eutro.ljdecomp.core.ops;

import io.github.eutro.ljdecomp.core.ext.ExtHolder;

/**
 * A kind of operation. Operations of the same kind share a key and differ
 * only in their immediate argument, if any.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
