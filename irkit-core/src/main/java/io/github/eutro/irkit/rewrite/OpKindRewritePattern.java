package io.github.eutro.irkit.rewrite;

import io.github.eutro.irkit.ir.OpKind;
import io.github.eutro.irkit.ir.Operation;

/**
 * A pattern which only considers operations of one kind.
 */
public abstract class OpKindRewritePattern implements RewritePattern {
    private final OpKind kind;

    protected OpKindRewritePattern(OpKind kind) {
        this.kind = kind;
    }

    public OpKind getKind() {
        return kind;
    }

    @Override
    public final void matchAndRewrite(Operation op, PatternRewriter rewriter) {
        if (op.getKind() == kind) {
            rewrite(op, rewriter);
        }
    }

    protected abstract void rewrite(Operation op, PatternRewriter rewriter);
}
