package io.github.eutro.irkit.match;

/**
 * A condition on the variables of a {@link Query}.
 * <p>
 * A constraint may read variables bound by constraints before it, and may
 * bind further variables.
 */
@FunctionalInterface
public interface Constraint {
    /**
     * Check the constraint, binding any variables it defines.
     *
     * @param ctx The match context.
     * @return Whether the constraint holds.
     */
    boolean match(MatchContext ctx);
}
