package io.github.eutro.irkit.rewrite;

import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.match.Match;
import io.github.eutro.irkit.match.Query;

import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * A pattern which runs an action on the bindings of a {@link Query}, when it matches.
 */
public class QueryRewritePattern implements RewritePattern {
    private final Query query;
    private final BiConsumer<Match, PatternRewriter> action;

    public QueryRewritePattern(Query query, BiConsumer<Match, PatternRewriter> action) {
        this.query = query;
        this.action = action;
    }

    public Query getQuery() {
        return query;
    }

    @Override
    public void matchAndRewrite(Operation op, PatternRewriter rewriter) {
        Optional<Match> match = query.match(op);
        if (match.isPresent()) {
            action.accept(match.get(), rewriter);
        }
    }
}
