package io.github.eutro.irkit.rewrite;

import io.github.eutro.irkit.ir.Operation;

/**
 * A rewrite of mutable operations.
 */
@FunctionalInterface
public interface RewritePattern {
    /**
     * Try to rewrite {@code op}. All changes must go through {@code rewriter};
     * a pattern that does not apply simply returns without using it.
     *
     * @param op       The operation.
     * @param rewriter The mutation handle.
     */
    void matchAndRewrite(Operation op, PatternRewriter rewriter);
}
