package io.github.eutro.irkit.ext;

import io.github.eutro.irkit.ir.Block;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Region;

/**
 * Exts shared across the IR core.
 * <p>
 * The owner links are stored in fields by the nodes that carry them.
 */
public class CommonExts {
    /**
     * The block an operation is placed in.
     */
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");
    /**
     * The region a block is placed in.
     */
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    /**
     * The operation a region is attached to.
     */
    public static final Ext<Operation> OWNING_OP = Ext.create(Operation.class, "OWNING_OP");

    /**
     * Whether an operation has no side effects, so it may be erased once its results are unused.
     * Usually attached to an {@link io.github.eutro.irkit.ir.OpKind}.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    public static boolean isPure(ExtContainer ec) {
        return ec.getNullable(IS_PURE) == Boolean.TRUE;
    }
}
