package io.github.eutro.ljdecomp.core.util;

/**
 * A function, composable without the ceremony of {@link java.util.function.Function}.
 */
public interface F<A, B> {
    B apply(A a);

    default <C> F<A, C> andThen(F<B, C> g) {
        return a -> g.apply(apply(a));
    }
}
