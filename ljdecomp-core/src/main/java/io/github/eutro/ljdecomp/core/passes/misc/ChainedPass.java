package io.github.eutro.ljdecomp.core.passes.misc;

import io.github.eutro.ljdecomp.core.passes.IRPass;

/**
 * Runs one pass, then another on its result.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> next;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        this.first = first;
        this.next = next;
    }

    @Override
    public boolean isInPlace() {
        return first.isInPlace() && next.isInPlace();
    }

    @Override
    public C run(A a) {
        return next.run(first.run(a));
    }

    @Override
    public String toString() {
        return first + " then " + next;
    }
}
