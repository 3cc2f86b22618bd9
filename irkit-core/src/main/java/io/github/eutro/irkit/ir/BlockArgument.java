package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;
import org.jetbrains.annotations.Nullable;

/**
 * A value passed into a block.
 */
public final class BlockArgument extends Value {
    private final Block block;
    private final int index;

    BlockArgument(Attribute type, Block block, int index) {
        super(type);
        this.block = block;
        this.index = index;
    }

    public Block getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public @Nullable Operation getDefiningOp() {
        return null;
    }

    @Override
    public String describe() {
        return "arg#" + index + " of " + block.describe();
    }
}
