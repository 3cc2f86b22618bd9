package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.util.SealedList;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

public final class IRegion {
    private final SealedList<IBlock> blocks;

    public IRegion(List<IBlock> blocks) {
        this.blocks = SealedList.of(blocks);
    }

    public static IRegion of(IBlock... blocks) {
        return new IRegion(Arrays.asList(blocks));
    }

    public SealedList<IBlock> getBlocks() {
        return blocks;
    }

    @Nullable
    public IBlock getBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Get the operations of the entry block.
     *
     * @return The operations, empty if there are no blocks.
     */
    public SealedList<IOp> getOps() {
        IBlock block = getBlock();
        return block == null ? SealedList.<IOp>empty() : block.getOps();
    }

    public void walk(Consumer<? super IOp> visitor) {
        for (IBlock block : blocks) {
            block.walk(visitor);
        }
    }

    public boolean walkAbortable(Predicate<? super IOp> visitor) {
        for (IBlock block : blocks) {
            if (!block.walkAbortable(visitor)) return false;
        }
        return true;
    }

    public boolean isValueUsedInside(IValue value) {
        return !walkAbortable(op -> !op.getOperands().contains(value));
    }
}
