package io.github.eutro.irkit.immutable;

import java.util.List;
import java.util.Optional;

/**
 * A rewrite of immutable operations.
 */
@FunctionalInterface
public interface IRewritePattern {
    /**
     * Try to rewrite an operation.
     *
     * @param op The operation.
     * @return The operations replacing it, the last of which produces the replacement results,
     * or empty if the pattern does not apply.
     */
    Optional<List<IOp>> rewrite(IOp op);
}
