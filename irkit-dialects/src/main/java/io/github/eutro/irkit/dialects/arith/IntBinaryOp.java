package io.github.eutro.irkit.dialects.arith;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.*;

import java.util.List;
import java.util.Map;

/**
 * An integer operation of two operands of the same type as its result,
 * such as {@code arith.addi}. How it folds is given by its kind's {@link ArithDialect#FOLDER folder}.
 */
public class IntBinaryOp extends Operation {
    public IntBinaryOp(OpKind kind,
                       List<? extends Value> operands,
                       List<? extends Attribute> resultTypes,
                       Map<String, ? extends Attribute> attributes,
                       List<Block> successors,
                       List<Region> regions) {
        super(kind, operands, resultTypes, attributes, successors, regions);
    }

    public Value getLhs() {
        return getOperand(0);
    }

    public Value getRhs() {
        return getOperand(1);
    }

    public long fold(long lhs, long rhs) {
        return getExtOrThrow(ArithDialect.FOLDER).applyAsLong(lhs, rhs);
    }
}
