package io.github.eutro.ljdecomp.core.ext;

import io.github.eutro.ljdecomp.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext} values can be attached to.
 * See the {@link io.github.eutro.ljdecomp.core.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach a value, replacing any previous value of the same ext.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of an ext, if there is one.
     *
     * @param ext The ext.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Look up the value of an ext.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Look up the value of an ext that must be present.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     * @throws IllegalStateException If there is no value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException("missing ext " + ext + " on " + this);
        }
        return value;
    }

    /**
     * Look up the value of an ext, running a pass that computes it if it is absent.
     *
     * @param ext  The ext.
     * @param o    The object to run the pass on.
     * @param pass The pass that attaches the ext.
     * @param <T>  The value type.
     * @param <O>  The type the pass runs on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
