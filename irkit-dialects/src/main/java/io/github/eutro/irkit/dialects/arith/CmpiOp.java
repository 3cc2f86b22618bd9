package io.github.eutro.irkit.dialects.arith;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.ir.*;

import java.util.List;
import java.util.Map;

/**
 * {@code arith.cmpi}: compares two integers, producing an {@code i1}.
 * The comparison is encoded in the {@code predicate} attribute, see {@link CmpPredicate}.
 */
public class CmpiOp extends Operation {
    public CmpiOp(OpKind kind,
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

    /**
     * Get the predicate of this comparison.
     *
     * @return The predicate.
     * @throws DiagnosticException If the predicate attribute is missing or not a known predicate.
     */
    public CmpPredicate getPredicate() {
        long value = getAttr("predicate", IntegerAttr.class).getValue();
        CmpPredicate predicate = CmpPredicate.byValue(value);
        if (predicate == null) {
            throw new DiagnosticException(this, "unknown comparison predicate " + value);
        }
        return predicate;
    }
}
