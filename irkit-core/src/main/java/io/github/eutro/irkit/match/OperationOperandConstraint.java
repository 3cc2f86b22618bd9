package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Binds an operand of an operation, selected by position or by the field name its kind gives it.
 * Fails if there is no such operand.
 */
public class OperationOperandConstraint implements Constraint {
    private final OperationVariable opVar;
    @Nullable
    private final String field;
    private final int index;
    private final Variable<? extends Value> operandVar;

    public OperationOperandConstraint(OperationVariable opVar, String field, Variable<? extends Value> operandVar) {
        this.opVar = opVar;
        this.field = field;
        this.index = -1;
        this.operandVar = operandVar;
    }

    public OperationOperandConstraint(OperationVariable opVar, int index, Variable<? extends Value> operandVar) {
        this.opVar = opVar;
        this.field = null;
        this.index = index;
        this.operandVar = operandVar;
    }

    @Override
    public boolean match(MatchContext ctx) {
        Operation op = opVar.get(ctx);
        Value operand;
        if (field != null) {
            operand = op.getNamedOperand(field);
        } else {
            operand = index < op.getNumOperands() ? op.getOperand(index) : null;
        }
        return operand != null && operandVar.trySet(ctx, operand);
    }

    @Override
    public String toString() {
        return operandVar.getName() + " = " + opVar.getName() + ".operands[" + (field == null ? index : field) + "]";
    }
}
