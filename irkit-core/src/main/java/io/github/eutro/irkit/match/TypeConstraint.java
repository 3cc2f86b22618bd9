package io.github.eutro.irkit.match;

/**
 * Requires that a variable is bound to an instance of a class.
 */
public class TypeConstraint implements Constraint {
    private final Variable<?> var;
    private final Class<?> type;

    public TypeConstraint(Variable<?> var, Class<?> type) {
        this.var = var;
        this.type = type;
    }

    @Override
    public boolean match(MatchContext ctx) {
        return type.isInstance(var.get(ctx));
    }

    @Override
    public String toString() {
        return var.getName() + " instanceof " + type.getSimpleName();
    }
}
