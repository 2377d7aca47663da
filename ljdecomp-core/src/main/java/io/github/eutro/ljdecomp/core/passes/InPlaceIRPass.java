package io.github.eutro.ljdecomp.core.passes;

/**
 * An {@link IRPass} that modifies its input, usually by attaching exts.
 *
 * @param <T> The IR type.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
