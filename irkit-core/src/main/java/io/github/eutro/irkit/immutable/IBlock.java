package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.util.SealedList;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An immutable block: sealed arguments and a sealed list of operations.
 */
public final class IBlock {
    private final SealedList<IBlockArg> args;
    private final SealedList<IOp> ops;

    /**
     * Construct a block with fresh arguments of the given types.
     *
     * @param argTypes The types of the arguments.
     * @param ops      The operations.
     */
    public IBlock(List<? extends Attribute> argTypes, List<IOp> ops) {
        SealedList.Builder<IBlockArg> args = SealedList.builder();
        for (Attribute type : argTypes) {
            args.add(new IBlockArg(type, args.size()));
        }
        this.args = args.seal();
        this.ops = SealedList.of(ops);
        for (IBlockArg arg : this.args) {
            arg.attach(this);
        }
    }

    private IBlock(List<IOp> ops, SealedList<IBlockArg> args) {
        this.args = args;
        this.ops = SealedList.of(ops);
        for (IBlockArg arg : args) {
            arg.attach(this);
        }
    }

    /**
     * Construct a block claiming the given arguments, which operations may already refer to.
     *
     * @param args The arguments, which must not belong to another block.
     * @param ops  The operations.
     * @return The block.
     */
    public static IBlock withArgs(List<IBlockArg> args, List<IOp> ops) {
        return new IBlock(ops, SealedList.of(args));
    }

    public SealedList<IBlockArg> getArgs() {
        return args;
    }

    public IBlockArg getArg(int index) {
        return args.get(index);
    }

    public List<Attribute> getArgTypes() {
        return args.stream().map(IValue::getType).collect(Collectors.toList());
    }

    public SealedList<IOp> getOps() {
        return ops;
    }

    public void walk(Consumer<? super IOp> visitor) {
        for (IOp op : ops) {
            op.walk(visitor);
        }
    }

    public boolean walkAbortable(Predicate<? super IOp> visitor) {
        for (IOp op : ops) {
            if (!op.walkAbortable(visitor)) return false;
        }
        return true;
    }

    /**
     * Rebuild this block with the values in {@code env} substituted.
     *
     * @param env The substitution, which is extended as for {@link #rebuild(List, IBlock, Map)}.
     * @return The new block.
     */
    public IBlock rebuildWithSubstitution(Map<IValue, IValue> env) {
        return rebuild(ops, this, env);
    }

    /**
     * Build a new block from {@code ops}, with fresh arguments of the same types
     * as those of {@code oldBlock}.
     * <p>
     * Uses of values in {@code env} are replaced by their mapping. An operation is rebuilt
     * only if one of its operands is in {@code env}, or if one of its regions contains an
     * operation that has to be rebuilt; every other operation, region and block is reused
     * as-is. {@code env} is extended with the mapping of each old argument to its new
     * argument, and each old result of a rebuilt operation to its new result, so that
     * anything depending on a rebuilt operation is rebuilt too.
     *
     * @param ops      The operations of the new block.
     * @param oldBlock The block being replaced.
     * @param env      The substitution.
     * @return The new block.
     */
    public static IBlock rebuild(List<IOp> ops, IBlock oldBlock, Map<IValue, IValue> env) {
        return rebuild(ops, oldBlock, env, Collections.emptyMap());
    }

    private static IBlock rebuild(List<IOp> ops,
                                  IBlock oldBlock,
                                  Map<IValue, IValue> env,
                                  Map<IBlock, IBlock> blockEnv) {
        List<IBlockArg> newArgs = new ArrayList<>(oldBlock.args.size());
        for (IBlockArg oldArg : oldBlock.args) {
            IBlockArg newArg = new IBlockArg(oldArg.getType(), oldArg.getIndex());
            newArgs.add(newArg);
            env.put(oldArg, newArg);
        }
        List<IOp> newOps = new ArrayList<>(ops.size());
        for (IOp op : ops) {
            newOps.add(substituteIfRequired(op, env, blockEnv));
        }
        return withArgs(newArgs, newOps);
    }

    /**
     * Point the successors of the operations in {@code blocks} at the blocks that replaced them.
     * <p>
     * {@code blocks} is the new block list of a region whose old block list was {@code oldBlocks}.
     * A block with a branch to a replaced block is rebuilt, which may in turn replace it,
     * until no successor refers to a stale block.
     *
     * @param oldBlocks The blocks of the region before rewriting.
     * @param blocks    The blocks of the region after rewriting, at the same positions.
     * @param env       The substitution, extended with the values of rebuilt blocks.
     * @return The blocks, with their successors remapped.
     */
    static List<IBlock> retarget(List<IBlock> oldBlocks, List<IBlock> blocks, Map<IValue, IValue> env) {
        Map<IBlock, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < oldBlocks.size(); i++) {
            positions.put(oldBlocks.get(i), i);
        }
        List<IBlock> current = new ArrayList<>(blocks);
        boolean changed = true;
        // successors always refer to blocks built earlier, so this terminates
        while (changed) {
            changed = false;
            Map<IBlock, IBlock> blockEnv = new IdentityHashMap<>();
            for (Map.Entry<IBlock, Integer> entry : positions.entrySet()) {
                IBlock latest = current.get(entry.getValue());
                if (latest != entry.getKey()) blockEnv.put(entry.getKey(), latest);
            }
            if (blockEnv.isEmpty()) break;
            for (int i = 0; i < current.size(); i++) {
                IBlock block = current.get(i);
                if (!branchesTo(block, blockEnv)) continue;
                IBlock next = rebuild(block.getOps(), block, env, blockEnv);
                positions.put(next, i);
                current.set(i, next);
                changed = true;
            }
        }
        return current;
    }

    private static boolean branchesTo(IBlock block, Map<IBlock, IBlock> blockEnv) {
        for (IOp op : block.getOps()) {
            for (IBlock successor : op.getSuccessors()) {
                if (blockEnv.containsKey(successor)) return true;
            }
        }
        return false;
    }

    private static IOp substituteIfRequired(IOp op, Map<IValue, IValue> env, Map<IBlock, IBlock> blockEnv) {
        boolean required = false;
        for (IValue operand : op.getOperands()) {
            if (env.containsKey(operand)) {
                required = true;
                break;
            }
        }

        List<IBlock> newSuccessors = new ArrayList<>(op.getSuccessors().size());
        for (IBlock successor : op.getSuccessors()) {
            IBlock mapped = blockEnv.get(successor);
            if (mapped != null) {
                required = true;
                newSuccessors.add(mapped);
            } else {
                newSuccessors.add(successor);
            }
        }

        List<IRegion> newRegions = new ArrayList<>(op.getRegions().size());
        for (IRegion region : op.getRegions()) {
            boolean regionChanged = false;
            List<IBlock> newBlocks = new ArrayList<>(region.getBlocks().size());
            for (IBlock block : region.getBlocks()) {
                if (refersTo(block, env)) {
                    regionChanged = true;
                    newBlocks.add(rebuild(block.getOps(), block, env));
                } else {
                    newBlocks.add(block);
                }
            }
            if (regionChanged) {
                required = true;
                newRegions.add(new IRegion(retarget(region.getBlocks(), newBlocks, env)));
            } else {
                newRegions.add(region);
            }
        }

        if (!required) return op;
        return IOpBuilder.fromOp(op, env)
                .successors(newSuccessors)
                .regions(newRegions)
                .buildOp();
    }

    static boolean refersTo(IBlock block, Map<IValue, IValue> env) {
        return !block.walkAbortable(op -> {
            for (IValue operand : op.getOperands()) {
                if (env.containsKey(operand)) return false;
            }
            return true;
        });
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("block");
        sb.append(getArgTypes().stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")")));
        sb.append(" {\n");
        for (IOp op : ops) {
            sb.append("  ").append(op).append('\n');
        }
        return sb.append('}').toString();
    }
}
