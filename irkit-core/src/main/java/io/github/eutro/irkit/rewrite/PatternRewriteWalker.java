package io.github.eutro.irkit.rewrite;

import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.passes.InPlaceIRPass;
import io.github.eutro.irkit.passes.meta.VerifyIntegrity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies a pattern to every operation nested in a root operation, until no more applications are possible.
 * <p>
 * Operations are processed from a FIFO worklist, seeded in pre-order. After each rewrite,
 * the operations it added or modified are queued, unless they are already queued.
 * Operations no longer nested in the root when they are reached are skipped.
 * <p>
 * There is no bound on the number of rewrites; patterns must not undo each other.
 */
public class PatternRewriteWalker implements InPlaceIRPass<Operation> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PatternRewriteWalker.class);

    /**
     * Whether walkers verify the integrity of the IR after every rewrite, by default.
     * <p>
     * Read from the {@code IRKIT_VERIFY_REWRITES} environment variable.
     */
    public static boolean VERIFY_REWRITES = System.getenv("IRKIT_VERIFY_REWRITES") != null;

    private final RewritePattern pattern;
    private final boolean verifyRewrites;

    public PatternRewriteWalker(RewritePattern pattern, boolean verifyRewrites) {
        this.pattern = pattern;
        this.verifyRewrites = verifyRewrites;
    }

    public PatternRewriteWalker(RewritePattern pattern) {
        this(pattern, VERIFY_REWRITES);
    }

    @Override
    public void runInPlace(Operation root) {
        rewriteModule(root);
    }

    /**
     * Rewrite the operations nested in {@code root} to a fixpoint.
     *
     * @param root The root operation, which is not itself rewritten.
     * @return Whether anything was changed.
     */
    public boolean rewriteModule(Operation root) {
        Deque<Operation> worklist = new ArrayDeque<>();
        Set<Operation> pending = new HashSet<>();
        Iterator<Operation> it = root.preOrder().iterator();
        it.next();
        while (it.hasNext()) {
            Operation op = it.next();
            worklist.addLast(op);
            pending.add(op);
        }

        int rewrites = 0;
        while (!worklist.isEmpty()) {
            Operation op = worklist.pollFirst();
            pending.remove(op);
            if (!isNestedIn(op, root)) continue;

            PatternRewriter rewriter = new PatternRewriter(op);
            String description = LOGGER.isDebugEnabled() ? op.describe() : null;
            try {
                pattern.matchAndRewrite(op, rewriter);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("rewriting " + op.describe()));
                throw e;
            }
            if (!rewriter.hasDoneAction()) continue;

            rewrites++;
            LOGGER.debug("rewrote {}", description);
            enqueue(rewriter.getAddedOps(), root, worklist, pending);
            enqueue(rewriter.getModifiedOps(), root, worklist, pending);
            if (verifyRewrites) {
                VerifyIntegrity.INSTANCE.runInPlace(root);
            }
        }
        LOGGER.debug("reached fixpoint in {} after {} rewrite(s)", root.describe(), rewrites);
        return rewrites != 0;
    }

    private static void enqueue(List<Operation> ops, Operation root, Deque<Operation> worklist, Set<Operation> pending) {
        for (Operation op : ops) {
            if (isNestedIn(op, root) && pending.add(op)) {
                worklist.addLast(op);
            }
        }
    }

    private static boolean isNestedIn(Operation op, Operation root) {
        for (Operation parent = op.getParentOp(); parent != null; parent = parent.getParentOp()) {
            if (parent == root) return true;
        }
        return false;
    }
}
