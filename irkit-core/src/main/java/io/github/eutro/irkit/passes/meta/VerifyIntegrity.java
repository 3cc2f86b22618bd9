package io.github.eutro.irkit.passes.meta;

import io.github.eutro.irkit.ir.*;
import io.github.eutro.irkit.passes.InPlaceIRPass;

import java.util.List;

/**
 * Checks the structural invariants of an operation and everything nested in it:
 * parent links, result and argument positions, use lists, and that successors
 * are in the same region as the operation branching to them.
 * <p>
 * Violations are reported with an {@link IllegalStateException}.
 */
public class VerifyIntegrity implements InPlaceIRPass<Operation> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Operation root) {
        root.walk(this::verifyOp);
    }

    private void verifyOp(Operation op) {
        List<OpResult> results = op.getResults();
        for (int i = 0; i < results.size(); i++) {
            OpResult result = results.get(i);
            if (result.getOp() != op || result.getIndex() != i) {
                throw new IllegalStateException(String.format("result %d of %s is stamped as %s",
                        i, op.describe(), result.describe()));
            }
            verifyUses(result);
        }

        for (int i = 0; i < op.getNumOperands(); i++) {
            Value operand = op.getOperand(i);
            int count = 0;
            for (Use use : operand.getUses()) {
                if (use.getUser() == op && use.getIndex() == i) count++;
            }
            if (count != 1) {
                throw new IllegalStateException(String.format("%s is operand %d of %s, but appears %d time(s) in its use list" +
                                "\nuses: %s",
                        operand.describe(), i, op.describe(), count, operand.getUses()));
            }
        }

        if (!op.getSuccessors().isEmpty()) {
            Region region = op.getParentRegion();
            for (Block successor : op.getSuccessors()) {
                if (region == null || successor.getParentRegion() != region) {
                    throw new IllegalStateException(String.format("successor %s of %s is not in the same region",
                            successor.describe(), op.describe()));
                }
            }
        }

        for (Region region : op.getRegions()) {
            if (region.getParentOp() != op) {
                throw new IllegalStateException(String.format("%s of %s has parent %s",
                        region.describe(), op.describe(), region.getParentOp()));
            }
            for (Block block : region.getBlocks()) {
                verifyBlock(block, region);
            }
        }
    }

    private void verifyBlock(Block block, Region region) {
        if (block.getParentRegion() != region) {
            throw new IllegalStateException(String.format("%s is listed in %s, but its parent is %s",
                    block.describe(), region.describe(), block.getParentRegion()));
        }
        List<BlockArgument> args = block.getArgs();
        for (int i = 0; i < args.size(); i++) {
            BlockArgument arg = args.get(i);
            if (arg.getBlock() != block || arg.getIndex() != i) {
                throw new IllegalStateException(String.format("argument %d of %s is stamped as %s",
                        i, block.describe(), arg.describe()));
            }
            verifyUses(arg);
        }
        for (Operation op : block.getOps()) {
            if (op.getParentBlock() != block) {
                throw new IllegalStateException(String.format("%s is listed in %s, but its parent is %s",
                        op.describe(), block.describe(), op.getParentBlock()));
            }
        }
    }

    private void verifyUses(Value value) {
        for (Use use : value.getUses()) {
            Operation user = use.getUser();
            if (use.getIndex() >= user.getNumOperands() || user.getOperand(use.getIndex()) != value) {
                throw new IllegalStateException(String.format("%s lists a stale use: %s",
                        value.describe(), use));
            }
        }
    }
}
