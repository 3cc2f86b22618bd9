package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;

/**
 * A value defined by an operation.
 */
public final class OpResult extends Value {
    private final Operation op;
    private final int index;

    OpResult(Attribute type, Operation op, int index) {
        super(type);
        this.op = op;
        this.index = index;
    }

    public Operation getOp() {
        return op;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public Operation getDefiningOp() {
        return op;
    }

    @Override
    public String describe() {
        return "result#" + index + " of " + op.describe();
    }
}
