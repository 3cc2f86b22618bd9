package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.passes.IRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies {@link IRewritePattern}s to immutable IR until none of them applies.
 * <p>
 * Patterns are tried in order on each operation, after its regions were rewritten,
 * and the first that applies wins. A pass over a block rebuilds only what depends on
 * a replaced operation; everything else is shared with the input.
 */
public class IRewriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(IRewriter.class);

    private final List<IRewritePattern> patterns;
    // every substitution made, from old value to new
    private final Map<IValue, IValue> trace = new HashMap<>();

    public IRewriter(List<IRewritePattern> patterns) {
        this.patterns = new ArrayList<>(patterns);
    }

    public IRewriter(IRewritePattern... patterns) {
        this(Arrays.asList(patterns));
    }

    /**
     * Rewrite a mutable operation by way of the immutable IR.
     *
     * @param root The operation, which is not modified.
     * @return A new mutable operation holding the rewritten IR.
     */
    public Operation rewriteModule(Operation root) {
        IRPass<Operation, Operation> pipeline = new FromMutable()
                .then(this::rewriteOp)
                .then(new ToMutable());
        return pipeline.run(root);
    }

    public IOp rewriteOp(IOp op) {
        List<IRegion> regions = new ArrayList<>(op.getRegions().size());
        boolean changed = false;
        for (IRegion region : op.getRegions()) {
            IRegion newRegion = rewriteRegion(region);
            changed |= newRegion != region;
            regions.add(newRegion);
        }
        return changed ? IOpBuilder.fromOp(op).regions(regions).buildOp() : op;
    }

    public IRegion rewriteRegion(IRegion region) {
        IRegion current = region;
        int passes = 0;
        while (true) {
            IRegion next = rewriteRegionOnce(current);
            if (next == null) break;
            current = next;
            passes++;
        }
        if (passes != 0) LOGGER.debug("region converged after {} changing pass(es)", passes);
        return current;
    }

    /**
     * Rewrite a block until no pattern applies.
     *
     * @param block The block.
     * @return The rewritten block, or {@code block} itself if nothing applied.
     */
    public IBlock rewriteBlock(IBlock block) {
        IBlock current = block;
        while (true) {
            Map<IValue, IValue> env = new HashMap<>();
            IBlock next = rewriteBlockOnce(current, env);
            if (next == null) return current;
            trace.putAll(env);
            current = next;
        }
    }

    /**
     * Find what a value was replaced by in the rewrites done so far.
     *
     * @param value A value of the IR before rewriting.
     * @return The value that took its place, or {@code value} if it was never replaced.
     */
    public IValue resolve(IValue value) {
        IValue current = value;
        IValue next;
        while ((next = trace.get(current)) != null && !next.equals(current)) {
            current = next;
        }
        return current;
    }

    @Nullable
    private IRegion rewriteRegionOnce(IRegion region) {
        // shared by the blocks of the region, so later blocks see replaced values
        Map<IValue, IValue> env = new HashMap<>();
        List<IBlock> blocks = new ArrayList<>(region.getBlocks().size());
        boolean changed = false;
        for (IBlock block : region.getBlocks()) {
            IBlock next = rewriteBlockOnce(block, env);
            if (next == null && IBlock.refersTo(block, env)) {
                next = block.rebuildWithSubstitution(env);
            }
            if (next == null) {
                blocks.add(block);
            } else {
                blocks.add(next);
                changed = true;
            }
        }
        if (!changed) return null;
        IRegion next = new IRegion(IBlock.retarget(region.getBlocks(), blocks, env));
        trace.putAll(env);
        return next;
    }

    @Nullable
    private IBlock rewriteBlockOnce(IBlock block, Map<IValue, IValue> env) {
        List<IOp> newOps = new ArrayList<>(block.getOps().size());
        boolean changed = false;
        for (IOp op : block.getOps()) {
            IOp current = op;

            boolean nestedChanged = false;
            List<IRegion> regions = new ArrayList<>(op.getRegions().size());
            for (IRegion region : op.getRegions()) {
                IRegion next = rewriteRegionOnce(region);
                nestedChanged |= next != null;
                regions.add(next == null ? region : next);
            }
            if (nestedChanged) {
                current = IOpBuilder.fromOp(op, env).regions(regions).buildOp();
                changed = true;
            } else if (usesAny(op, env)) {
                current = IOpBuilder.fromOp(op, env).buildOp();
            }

            List<IOp> replacement = applyPatterns(current);
            if (replacement == null) {
                newOps.add(current);
                continue;
            }
            IOp last = replacement.get(replacement.size() - 1);
            if (last.getResults().size() != current.getResults().size()) {
                throw new IllegalStateException(String.format("rewrite of %s produced %d result(s), expected %d",
                        current.getName(), last.getResults().size(), current.getResults().size()));
            }
            for (int i = 0; i < last.getResults().size(); i++) {
                env.put(current.getResults().get(i), last.getResults().get(i));
                env.put(op.getResults().get(i), last.getResults().get(i));
            }
            newOps.addAll(replacement);
            changed = true;
        }
        if (!changed) return null;
        return IBlock.rebuild(newOps, block, env);
    }

    private static boolean usesAny(IOp op, Map<IValue, IValue> env) {
        for (IValue operand : op.getOperands()) {
            if (env.containsKey(operand)) return true;
        }
        return false;
    }

    @Nullable
    private List<IOp> applyPatterns(IOp op) {
        for (IRewritePattern pattern : patterns) {
            Optional<List<IOp>> result = pattern.rewrite(op);
            if (result.isPresent() && !result.get().isEmpty()) {
                return result.get();
            }
        }
        return null;
    }
}
