package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.OpResult;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Binds a result of an operation, selected by position or by the field name its kind gives it.
 * Fails if there is no such result.
 */
public class OperationResultConstraint implements Constraint {
    private final OperationVariable opVar;
    @Nullable
    private final String field;
    private final int index;
    private final Variable<? extends Value> resultVar;

    public OperationResultConstraint(OperationVariable opVar, String field, Variable<? extends Value> resultVar) {
        this.opVar = opVar;
        this.field = field;
        this.index = -1;
        this.resultVar = resultVar;
    }

    public OperationResultConstraint(OperationVariable opVar, int index, Variable<? extends Value> resultVar) {
        this.opVar = opVar;
        this.field = null;
        this.index = index;
        this.resultVar = resultVar;
    }

    @Override
    public boolean match(MatchContext ctx) {
        Operation op = opVar.get(ctx);
        OpResult result;
        if (field != null) {
            result = op.getNamedResult(field);
        } else {
            result = index < op.getResults().size() ? op.getResult(index) : null;
        }
        return result != null && resultVar.trySet(ctx, result);
    }

    @Override
    public String toString() {
        return resultVar.getName() + " = " + opVar.getName() + ".results[" + (field == null ? index : field) + "]";
    }
}
