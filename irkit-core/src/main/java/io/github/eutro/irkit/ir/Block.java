package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ext.CommonExts;
import io.github.eutro.irkit.ext.Ext;
import io.github.eutro.irkit.ext.ExtHolder;
import io.github.eutro.irkit.ext.TrackedList;
import io.github.eutro.irkit.util.SealedList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A basic block: a list of arguments and an ordered list of operations it owns.
 */
public final class Block extends ExtHolder {
    private final SealedList<BlockArgument> args;
    private final TrackedList<Operation> ops = new TrackedList<Operation>() {
        @Override
        protected void onAdded(Operation elt) {
            Ownership.checkInsertion(elt, Block.this);
            elt.attachExt(CommonExts.OWNING_BLOCK, Block.this);
        }

        @Override
        protected void onRemoved(Operation elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    public Block(List<? extends Attribute> argTypes) {
        SealedList.Builder<BlockArgument> args = SealedList.builder();
        for (Attribute type : argTypes) {
            args.add(new BlockArgument(type, this, args.size()));
        }
        this.args = args.seal();
    }

    public Block() {
        this(Collections.emptyList());
    }

    /**
     * Create an argument-less block holding the given operations.
     *
     * @param ops The operations.
     * @return The block.
     */
    public static Block of(Operation... ops) {
        Block block = new Block();
        block.addOps(Arrays.asList(ops));
        return block;
    }

    public SealedList<BlockArgument> getArgs() {
        return args;
    }

    public BlockArgument getArg(int index) {
        return args.get(index);
    }

    public List<Attribute> getArgTypes() {
        return args.stream().map(Value::getType).collect(Collectors.toList());
    }

    /**
     * Get the operations of this block.
     * <p>
     * Adding an operation to this list takes ownership of it, removing it releases it.
     *
     * @return The operations.
     */
    public List<Operation> getOps() {
        return ops;
    }

    @Nullable
    public Operation getFirstOp() {
        return ops.isEmpty() ? null : ops.get(0);
    }

    @Nullable
    public Operation getLastOp() {
        return ops.isEmpty() ? null : ops.get(ops.size() - 1);
    }

    public void addOp(Operation op) {
        ops.add(op);
    }

    public void addOps(List<Operation> ops) {
        this.ops.addAll(ops);
    }

    private int indexOfOrThrow(Operation anchor) {
        int index = ops.indexOf(anchor);
        if (index == -1) {
            throw new IllegalArgumentException(String.format("%s is not in %s", anchor.describe(), describe()));
        }
        return index;
    }

    public void insertOpBefore(Operation op, Operation anchor) {
        ops.add(indexOfOrThrow(anchor), op);
    }

    public void insertOpsBefore(List<Operation> newOps, Operation anchor) {
        ops.addAll(indexOfOrThrow(anchor), newOps);
    }

    public void insertOpAfter(Operation op, Operation anchor) {
        ops.add(indexOfOrThrow(anchor) + 1, op);
    }

    public void insertOpsAfter(List<Operation> newOps, Operation anchor) {
        ops.addAll(indexOfOrThrow(anchor) + 1, newOps);
    }

    /**
     * Remove an operation from this block, releasing ownership of it.
     * The operation keeps its operands and uses.
     *
     * @param op The operation.
     */
    public void detachOp(Operation op) {
        ops.remove(indexOfOrThrow(op));
    }

    @Nullable
    public Region getParentRegion() {
        return owner;
    }

    @Nullable
    public Operation getParentOp() {
        return owner == null ? null : owner.getParentOp();
    }

    public void walk(Consumer<? super Operation> visitor) {
        for (Operation op : ops) {
            op.walk(visitor);
        }
    }

    public boolean walkAbortable(Predicate<? super Operation> visitor) {
        for (Operation op : ops) {
            if (!op.walkAbortable(visitor)) return false;
        }
        return true;
    }

    String path() {
        if (owner == null) return "";
        return owner.path() + "/" + owner.getBlocks().indexOf(this);
    }

    public String describe() {
        String path = path();
        return "block@" + (path.isEmpty() ? "/" : path);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(describe());
        sb.append(args.stream().map(a -> a.getType().toString()).collect(Collectors.joining(", ", "(", ")")));
        sb.append(" {\n");
        for (Operation op : ops) {
            sb.append("  ").append(op).append('\n');
        }
        return sb.append('}').toString();
    }

    // exts
    private Region owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(@NotNull Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(@NotNull Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
