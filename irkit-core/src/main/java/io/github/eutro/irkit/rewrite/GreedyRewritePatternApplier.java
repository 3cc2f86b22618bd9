package io.github.eutro.irkit.rewrite;

import io.github.eutro.irkit.ir.Operation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tries patterns in order, stopping at the first that changes anything.
 */
public class GreedyRewritePatternApplier implements RewritePattern {
    private final List<RewritePattern> patterns;

    public GreedyRewritePatternApplier(List<? extends RewritePattern> patterns) {
        this.patterns = new ArrayList<>(patterns);
    }

    public GreedyRewritePatternApplier(RewritePattern... patterns) {
        this(Arrays.asList(patterns));
    }

    @Override
    public void matchAndRewrite(Operation op, PatternRewriter rewriter) {
        for (RewritePattern pattern : patterns) {
            pattern.matchAndRewrite(op, rewriter);
            if (rewriter.hasDoneAction()) return;
        }
    }
}
