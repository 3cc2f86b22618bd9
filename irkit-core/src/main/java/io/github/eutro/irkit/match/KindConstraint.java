package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.OpKind;

/**
 * Requires that an operation is of a given kind.
 */
public class KindConstraint implements Constraint {
    private final OperationVariable var;
    private final OpKind kind;

    public KindConstraint(OperationVariable var, OpKind kind) {
        this.var = var;
        this.kind = kind;
    }

    @Override
    public boolean match(MatchContext ctx) {
        return var.get(ctx).getKind() == kind;
    }

    @Override
    public String toString() {
        return var.getName() + " is " + kind.getName();
    }
}
