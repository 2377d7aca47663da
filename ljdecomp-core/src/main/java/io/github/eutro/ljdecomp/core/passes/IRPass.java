package io.github.eutro.ljdecomp.core.passes;

import io.github.eutro.ljdecomp.core.passes.misc.ChainedPass;

/**
 * A stage of the pipeline, turning one representation into the next.
 *
 * @param <A> The input.
 * @param <B> The output.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass modifies and returns its input rather than producing something new.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
