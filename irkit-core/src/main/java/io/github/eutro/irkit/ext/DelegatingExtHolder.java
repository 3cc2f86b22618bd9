package io.github.eutro.irkit.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another {@link ExtContainer}
 * for exts it does not hold itself.
 * <p>
 * Operations use this to see facts attached to their kind.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to delegate to.
     *
     * @return The delegate, or null.
     */
    @Nullable
    protected abstract ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
