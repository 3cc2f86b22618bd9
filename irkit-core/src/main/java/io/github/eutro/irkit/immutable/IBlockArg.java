package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.util.ImmutabilityViolationException;
import org.jetbrains.annotations.Nullable;

/**
 * An argument of an {@link IBlock}.
 * <p>
 * Arguments are created before their block, which claims them when it is constructed.
 */
public final class IBlockArg extends IValue {
    private final int index;
    @Nullable
    private IBlock block;

    public IBlockArg(Attribute type, int index) {
        super(type);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Get the block this is an argument of.
     *
     * @return The block, or null if it has not been claimed by one yet.
     */
    @Nullable
    public IBlock getBlock() {
        return block;
    }

    void attach(IBlock block) {
        if (this.block != null) {
            throw new ImmutabilityViolationException("block argument #" + index + " already belongs to a block");
        }
        this.block = block;
    }

    @Override
    public String toString() {
        return "arg#" + index;
    }
}
