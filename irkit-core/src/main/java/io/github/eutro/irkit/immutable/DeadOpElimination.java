package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.ext.CommonExts;
import io.github.eutro.irkit.passes.IRPass;

import java.util.*;

/**
 * Removes pure operations nested in an immutable operation whose results are unused,
 * until there are none left.
 * <p>
 * The operation itself is kept even if it is unused, as is any operation defining
 * one of the {@code live} values given at construction.
 */
public class DeadOpElimination implements IRPass<IOp, IOp> {
    public static final DeadOpElimination INSTANCE = new DeadOpElimination(Collections.emptySet());

    private final Set<IValue> live;

    public DeadOpElimination(Set<? extends IValue> live) {
        this.live = new HashSet<>(live);
    }

    @Override
    public IOp run(IOp root) {
        IOp current = root;
        Set<IValue> live = this.live;
        while (true) {
            Set<IValue> used = new HashSet<>(live);
            current.walk(op -> used.addAll(op.getOperands()));
            Map<IValue, IValue> env = new HashMap<>();
            IOp next = pruneOp(current, used, env);
            if (next == current) return current;
            live = follow(live, env);
            current = next;
        }
    }

    // live values may have been rebuilt
    private static Set<IValue> follow(Set<IValue> values, Map<IValue, IValue> env) {
        Set<IValue> followed = new HashSet<>();
        for (IValue value : values) {
            IValue current = value;
            IValue next;
            while ((next = env.get(current)) != null && !next.equals(current)) {
                current = next;
            }
            followed.add(current);
        }
        return followed;
    }

    private static IOp pruneOp(IOp op, Set<IValue> used, Map<IValue, IValue> env) {
        List<IRegion> regions = new ArrayList<>(op.getRegions().size());
        boolean changed = false;
        for (IRegion region : op.getRegions()) {
            IRegion next = pruneRegion(region, used, env);
            changed |= next != region;
            regions.add(next);
        }
        return changed ? IOpBuilder.fromOp(op).regions(regions).buildOp() : op;
    }

    private static IRegion pruneRegion(IRegion region, Set<IValue> used, Map<IValue, IValue> env) {
        List<IBlock> blocks = new ArrayList<>(region.getBlocks().size());
        boolean changed = false;
        for (IBlock block : region.getBlocks()) {
            IBlock next = pruneBlock(block, used, env);
            changed |= next != block;
            blocks.add(next);
        }
        return changed ? new IRegion(IBlock.retarget(region.getBlocks(), blocks, env)) : region;
    }

    private static IBlock pruneBlock(IBlock block, Set<IValue> used, Map<IValue, IValue> env) {
        List<IOp> kept = new ArrayList<>(block.getOps().size());
        boolean changed = false;
        for (IOp op : block.getOps()) {
            if (isDead(op, used)) {
                changed = true;
                continue;
            }

            boolean nestedChanged = false;
            List<IRegion> regions = new ArrayList<>(op.getRegions().size());
            for (IRegion region : op.getRegions()) {
                IRegion next = pruneRegion(region, used, env);
                nestedChanged |= next != region;
                regions.add(next);
            }
            if (nestedChanged) {
                kept.add(IOpBuilder.fromOp(op, env).regions(regions).buildOp());
                changed = true;
            } else if (usesAny(op, env)) {
                kept.add(IOpBuilder.fromOp(op, env).buildOp());
            } else {
                kept.add(op);
            }
        }
        if (!changed && !IBlock.refersTo(block, env)) return block;
        return IBlock.rebuild(kept, block, env);
    }

    private static boolean usesAny(IOp op, Map<IValue, IValue> env) {
        for (IValue operand : op.getOperands()) {
            if (env.containsKey(operand)) return true;
        }
        return false;
    }

    private static boolean isDead(IOp op, Set<IValue> used) {
        if (!CommonExts.isPure(op.getKind())) return false;
        for (IResult result : op.getResults()) {
            if (used.contains(result)) return false;
        }
        return true;
    }
}
