package io.github.eutro.irkit.passes;

import io.github.eutro.irkit.passes.misc.ChainedPass;

/**
 * A transformation from one form of IR to another.
 *
 * @param <A> The input IR type.
 * @param <B> The output IR type.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it.
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
