package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.ir.*;
import io.github.eutro.irkit.passes.IRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Converts mutable IR to immutable IR.
 * <p>
 * An instance remembers everything it has converted, so converting several operations
 * with the same instance shares values, blocks and operations between them. Operands
 * produced by operations that were not converted yet have their producers converted on
 * demand. Successor blocks are converted on demand too, and reused when their region
 * is converted.
 */
public class FromMutable implements IRPass<Operation, IOp> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FromMutable.class);

    private final Map<Value, IValue> valueMap = new HashMap<>();
    private final Map<Block, IBlock> blockMap = new HashMap<>();
    private final Map<Operation, IOp> opMap = new HashMap<>();
    private final Set<Block> inProgress = new HashSet<>();

    @Override
    public IOp run(Operation op) {
        return convertOp(op);
    }

    public IOp convertOp(Operation op) {
        IOp existing = opMap.get(op);
        if (existing != null) return existing;

        List<IValue> operands = new ArrayList<>(op.getNumOperands());
        for (Value operand : op.getOperands()) {
            operands.add(resolve(op, operand));
        }
        List<IBlock> successors = new ArrayList<>(op.getSuccessors().size());
        for (Block successor : op.getSuccessors()) {
            successors.add(convertBlock(successor));
        }
        List<IRegion> regions = new ArrayList<>(op.getRegions().size());
        for (Region region : op.getRegions()) {
            regions.add(convertRegion(region));
        }

        IOp iop = IOp.get(op.getKind(), operands, op.getResultTypes(), op.getAttributes(), successors, regions);
        opMap.put(op, iop);
        for (int i = 0; i < iop.getResults().size(); i++) {
            valueMap.put(op.getResult(i), iop.getResults().get(i));
        }
        return iop;
    }

    private IValue resolve(Operation user, Value operand) {
        IValue mapped = valueMap.get(operand);
        if (mapped != null) return mapped;
        if (operand instanceof OpResult) {
            OpResult result = (OpResult) operand;
            LOGGER.trace("converting {} on demand, used by {}", result.getOp().describe(), user.describe());
            convertOp(result.getOp());
            return valueMap.get(operand);
        }
        throw new UnresolvedReferenceException(String.format("%s, used by %s, is not defined in the converted IR",
                operand.describe(), user.describe()));
    }

    public IRegion convertRegion(Region region) {
        List<IBlock> blocks = new ArrayList<>(region.getBlocks().size());
        for (Block block : region.getBlocks()) {
            blocks.add(convertBlock(block));
        }
        return new IRegion(blocks);
    }

    public IBlock convertBlock(Block block) {
        IBlock existing = blockMap.get(block);
        if (existing != null) return existing;
        if (!inProgress.add(block)) {
            throw new UnresolvedReferenceException(String.format(
                    "%s is reached by a back edge, which immutable blocks cannot represent",
                    block.describe()));
        }
        List<IBlockArg> args = new ArrayList<>(block.getArgs().size());
        for (BlockArgument arg : block.getArgs()) {
            IBlockArg iarg = new IBlockArg(arg.getType(), arg.getIndex());
            valueMap.put(arg, iarg);
            args.add(iarg);
        }
        List<IOp> ops = new ArrayList<>(block.getOps().size());
        for (Operation op : block.getOps()) {
            ops.add(convertOp(op));
        }
        IBlock iblock = IBlock.withArgs(args, ops);
        inProgress.remove(block);
        blockMap.put(block, iblock);
        return iblock;
    }

    @Nullable
    public IValue lookup(Value value) {
        return valueMap.get(value);
    }

    @Nullable
    public IBlock lookup(Block block) {
        return blockMap.get(block);
    }
}
