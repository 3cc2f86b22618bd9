package io.github.eutro.irkit.dialects.arith;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.ir.*;

import java.util.List;
import java.util.Map;

/**
 * {@code arith.constant}: an integer constant, held in its {@code value} attribute.
 */
public class ConstantOp extends Operation {
    public ConstantOp(OpKind kind,
                      List<? extends Value> operands,
                      List<? extends Attribute> resultTypes,
                      Map<String, ? extends Attribute> attributes,
                      List<Block> successors,
                      List<Region> regions) {
        super(kind, operands, resultTypes, attributes, successors, regions);
    }

    public IntegerAttr getValue() {
        return getAttr("value", IntegerAttr.class);
    }
}
