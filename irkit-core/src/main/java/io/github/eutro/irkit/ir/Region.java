package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.ext.CommonExts;
import io.github.eutro.irkit.ext.Ext;
import io.github.eutro.irkit.ext.ExtHolder;
import io.github.eutro.irkit.ext.TrackedList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * An ordered list of blocks owned by an operation.
 */
public final class Region extends ExtHolder {
    private final TrackedList<Block> blocks = new TrackedList<Block>() {
        @Override
        protected void onAdded(Block elt) {
            Ownership.checkInsertion(elt, Region.this);
            elt.attachExt(CommonExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(Block elt) {
            elt.removeExt(CommonExts.OWNING_REGION);
        }
    };

    public Region() {
    }

    public Region(List<Block> blocks) {
        this.blocks.addAll(blocks);
    }

    public static Region of(Block... blocks) {
        return new Region(Arrays.asList(blocks));
    }

    /**
     * Get the blocks of this region.
     * <p>
     * Adding a block to this list takes ownership of it.
     *
     * @return The blocks.
     */
    public List<Block> getBlocks() {
        return blocks;
    }

    public void addBlock(Block block) {
        blocks.add(block);
    }

    /**
     * Get the first block of this region.
     *
     * @return The entry block, or null if the region is empty.
     */
    @Nullable
    public Block getBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Get the operations of the entry block of this region.
     *
     * @return The operations, empty if the region has no blocks.
     */
    public List<Operation> getOps() {
        Block block = getBlock();
        return block == null ? Collections.emptyList() : block.getOps();
    }

    @Nullable
    public Operation getParentOp() {
        return owner;
    }

    public void walk(Consumer<? super Operation> visitor) {
        for (Block block : blocks) {
            block.walk(visitor);
        }
    }

    public boolean walkAbortable(Predicate<? super Operation> visitor) {
        for (Block block : blocks) {
            if (!block.walkAbortable(visitor)) return false;
        }
        return true;
    }

    /**
     * Whether any operation nested in this region uses {@code value}.
     *
     * @param value The value.
     * @return Whether the value is used inside.
     */
    public boolean isValueUsedInside(Value value) {
        return !walkAbortable(op -> !op.getOperands().contains(value));
    }

    String path() {
        if (owner == null) return "";
        return owner.path() + "/" + owner.getRegions().indexOf(this);
    }

    public String describe() {
        String path = path();
        return "region@" + (path.isEmpty() ? "/" : path);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(describe()).append(" {\n");
        for (Block block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.append('}').toString();
    }

    // exts
    private Operation owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_OP) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(@NotNull Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_OP) {
            owner = (Operation) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(@NotNull Ext<T> ext) {
        if (ext == CommonExts.OWNING_OP) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
