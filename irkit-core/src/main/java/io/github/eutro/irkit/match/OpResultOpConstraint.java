package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.OpResult;
import io.github.eutro.irkit.ir.Value;

/**
 * Binds the operation defining a value. Fails if the value is a block argument.
 */
public class OpResultOpConstraint implements Constraint {
    private final Variable<? extends Value> valueVar;
    private final OperationVariable opVar;

    public OpResultOpConstraint(Variable<? extends Value> valueVar, OperationVariable opVar) {
        this.valueVar = valueVar;
        this.opVar = opVar;
    }

    @Override
    public boolean match(MatchContext ctx) {
        Value value = valueVar.get(ctx);
        return value instanceof OpResult && opVar.set(ctx, ((OpResult) value).getOp());
    }

    @Override
    public String toString() {
        return opVar.getName() + " = def(" + valueVar.getName() + ")";
    }
}
