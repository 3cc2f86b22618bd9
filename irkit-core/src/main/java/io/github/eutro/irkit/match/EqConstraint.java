package io.github.eutro.irkit.match;

/**
 * Requires that two variables are bound to equal entities, binding the second if it is not yet bound.
 */
public class EqConstraint implements Constraint {
    private final Variable<?> lhs;
    private final Variable<?> rhs;

    public EqConstraint(Variable<?> lhs, Variable<?> rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public boolean match(MatchContext ctx) {
        return rhs.trySet(ctx, lhs.get(ctx));
    }

    @Override
    public String toString() {
        return lhs.getName() + " == " + rhs.getName();
    }
}
