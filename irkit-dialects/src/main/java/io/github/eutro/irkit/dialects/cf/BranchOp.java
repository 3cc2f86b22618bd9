package io.github.eutro.irkit.dialects.cf;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.*;

import java.util.List;
import java.util.Map;

/**
 * {@code cf.br}: jumps to its only successor, passing its operands as the block's arguments.
 */
public class BranchOp extends Operation {
    public BranchOp(OpKind kind,
                    List<? extends Value> operands,
                    List<? extends Attribute> resultTypes,
                    Map<String, ? extends Attribute> attributes,
                    List<Block> successors,
                    List<Region> regions) {
        super(kind, operands, resultTypes, attributes, successors, regions);
    }

    public Block getDest() {
        return getSuccessor(0);
    }

    public List<Value> getDestOperands() {
        return getOperands();
    }
}
