package io.github.eutro.irkit.dialects.cf;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.*;

import java.util.List;
import java.util.Map;

/**
 * {@code cf.cond_br}: jumps to its first successor if its condition is true, and to its second otherwise.
 * <p>
 * The operands are the condition, then the arguments of the first successor,
 * then those of the second. The split is given by the number of arguments of the first successor.
 */
public class CondBranchOp extends Operation {
    public CondBranchOp(OpKind kind,
                        List<? extends Value> operands,
                        List<? extends Attribute> resultTypes,
                        Map<String, ? extends Attribute> attributes,
                        List<Block> successors,
                        List<Region> regions) {
        super(kind, operands, resultTypes, attributes, successors, regions);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public Block getThenBlock() {
        return getSuccessor(0);
    }

    public Block getElseBlock() {
        return getSuccessor(1);
    }

    public List<Value> getThenOperands() {
        return getOperands().subList(1, 1 + getThenBlock().getArgs().size());
    }

    public List<Value> getElseOperands() {
        return getOperands().subList(1 + getThenBlock().getArgs().size(), getNumOperands());
    }
}
