package io.github.eutro.ljdecomp.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that looks exts up in another container
 * when it has no value of its own.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container consulted for missing exts.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T own = super.getNullable(ext);
        if (own != null) return own;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
