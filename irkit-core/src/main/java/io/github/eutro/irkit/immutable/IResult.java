package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;

/**
 * The result of an {@link IOp}.
 * <p>
 * Results are equal if they are the same result of the same operation.
 */
public final class IResult extends IValue {
    private final IOp op;
    private final int index;

    IResult(Attribute type, IOp op, int index) {
        super(type);
        this.op = op;
        this.index = index;
    }

    public IOp getOp() {
        return op;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IResult)) return false;
        IResult that = (IResult) o;
        return op == that.op && index == that.index;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(op) * 31 + index;
    }

    @Override
    public String toString() {
        return "result#" + index + " of " + op.getName();
    }
}
