package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.*;
import io.github.eutro.irkit.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Converts immutable IR to mutable IR, constructing each operation through its kind's factory.
 * <p>
 * Every operand and successor must have been converted before it is used, or be
 * {@link #bind(IValue, Value) bound} up front; no placeholder is ever substituted.
 */
public class ToMutable implements IRPass<IOp, Operation> {
    private final Map<IValue, Value> valueMap = new HashMap<>();
    private final Map<IBlock, Block> blockMap = new HashMap<>();

    @Override
    public Operation run(IOp op) {
        return convertOp(op);
    }

    /**
     * Make uses of {@code ivalue} refer to the existing {@code value}.
     *
     * @param ivalue The immutable value.
     * @param value  The mutable value.
     * @return This converter.
     */
    public ToMutable bind(IValue ivalue, Value value) {
        valueMap.put(ivalue, value);
        return this;
    }

    public Operation convertOp(IOp iop) {
        List<Value> operands = new ArrayList<>(iop.getOperands().size());
        for (IValue ioperand : iop.getOperands()) {
            Value operand = valueMap.get(ioperand);
            if (operand == null) {
                throw new UnresolvedReferenceException(String.format("operand #%d (%s) of %s is not defined",
                        operands.size(), ioperand, iop.getName()));
            }
            operands.add(operand);
        }
        List<Block> successors = new ArrayList<>(iop.getSuccessors().size());
        for (IBlock isuccessor : iop.getSuccessors()) {
            Block successor = blockMap.get(isuccessor);
            if (successor == null) {
                throw new UnresolvedReferenceException(String.format(
                        "successor #%d (a block of %d argument(s) and %d operation(s)) of %s is not in an enclosing region",
                        successors.size(), isuccessor.getArgs().size(), isuccessor.getOps().size(), iop.getName()));
            }
            successors.add(successor);
        }
        List<Region> regions = new ArrayList<>(iop.getRegions().size());
        for (IRegion iregion : iop.getRegions()) {
            regions.add(convertRegion(iregion));
        }
        Map<String, Attribute> attributes = new LinkedHashMap<>(iop.getAttributes());

        Operation op = iop.getKind().create(operands, iop.getResultTypes(), attributes, successors, regions);
        for (int i = 0; i < iop.getResults().size(); i++) {
            valueMap.put(iop.getResults().get(i), op.getResult(i));
        }
        return op;
    }

    public Region convertRegion(IRegion iregion) {
        List<Block> blocks = new ArrayList<>(iregion.getBlocks().size());
        for (IBlock iblock : iregion.getBlocks()) {
            blocks.add(createBlock(iblock));
        }
        for (int i = 0; i < blocks.size(); i++) {
            fillBlock(blocks.get(i), iregion.getBlocks().get(i));
        }
        return new Region(blocks);
    }

    /**
     * Convert a single block, whose successors must already be converted.
     *
     * @param iblock The block.
     * @return The mutable block.
     */
    public Block convertBlock(IBlock iblock) {
        Block block = createBlock(iblock);
        fillBlock(block, iblock);
        return block;
    }

    private Block createBlock(IBlock iblock) {
        Block block = new Block(iblock.getArgTypes());
        blockMap.put(iblock, block);
        for (int i = 0; i < iblock.getArgs().size(); i++) {
            valueMap.put(iblock.getArg(i), block.getArg(i));
        }
        return block;
    }

    private void fillBlock(Block block, IBlock iblock) {
        for (IOp iop : iblock.getOps()) {
            block.addOp(convertOp(iop));
        }
    }

    @Nullable
    public Value lookup(IValue value) {
        return valueMap.get(value);
    }
}
