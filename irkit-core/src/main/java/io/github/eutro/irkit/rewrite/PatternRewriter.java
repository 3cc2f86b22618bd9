package io.github.eutro.irkit.rewrite;

import io.github.eutro.irkit.ir.*;

import java.util.*;

/**
 * The handle through which a {@link RewritePattern} changes the IR.
 * <p>
 * Every change is applied immediately, keeping use lists current. The rewriter
 * records whether anything was done, and which operations were added or modified,
 * so that the driver can revisit them.
 */
public class PatternRewriter {
    private final Operation matchedOp;
    private boolean hasDoneAction;
    private final Set<Operation> added = new LinkedHashSet<>();
    private final Set<Operation> modified = new LinkedHashSet<>();

    public PatternRewriter(Operation matchedOp) {
        this.matchedOp = matchedOp;
    }

    public Operation getMatchedOp() {
        return matchedOp;
    }

    public boolean hasDoneAction() {
        return hasDoneAction;
    }

    /**
     * Get the operations added by this rewriter, including operations nested in them, in the order they were added.
     *
     * @return The added operations.
     */
    public List<Operation> getAddedOps() {
        return new ArrayList<>(added);
    }

    /**
     * Get the existing operations whose operands were changed by this rewriter.
     *
     * @return The modified operations.
     */
    public List<Operation> getModifiedOps() {
        return new ArrayList<>(modified);
    }

    private Block parentOf(Operation op) {
        Block block = op.getParentBlock();
        if (block == null) {
            throw new IllegalStateException(op.describe() + " is not in a block");
        }
        return block;
    }

    private void recordAdded(List<Operation> ops) {
        for (Operation op : ops) {
            op.walk(added::add);
        }
        hasDoneAction = true;
    }

    public void insertOpBefore(Operation anchor, List<Operation> ops) {
        parentOf(anchor).insertOpsBefore(ops, anchor);
        recordAdded(ops);
    }

    public void insertOpAfter(Operation anchor, List<Operation> ops) {
        parentOf(anchor).insertOpsAfter(ops, anchor);
        recordAdded(ops);
    }

    public void insertOpBeforeMatchedOp(Operation... ops) {
        insertOpBeforeMatchedOp(Arrays.asList(ops));
    }

    public void insertOpBeforeMatchedOp(List<Operation> ops) {
        insertOpBefore(matchedOp, ops);
    }

    public void insertOpAfterMatchedOp(Operation... ops) {
        insertOpAfterMatchedOp(Arrays.asList(ops));
    }

    public void insertOpAfterMatchedOp(List<Operation> ops) {
        insertOpAfter(matchedOp, ops);
    }

    /**
     * Replace an operation with new ones, inserted where it was. The results of the
     * last new operation replace the results of {@code op}, which is then erased.
     *
     * @param op     The operation to replace.
     * @param newOps The operations replacing it.
     */
    public void replaceOp(Operation op, List<Operation> newOps) {
        if (newOps.isEmpty()) {
            if (!op.getResults().isEmpty()) {
                throw new IllegalArgumentException("cannot replace " + op.describe() + " with nothing, it has results");
            }
            eraseOp(op);
            return;
        }
        Operation last = newOps.get(newOps.size() - 1);
        if (last.getResults().size() != op.getResults().size()) {
            throw new IllegalArgumentException(String.format("cannot replace %s (%d result(s)) with %s (%d result(s))",
                    op.describe(), op.getResults().size(), last.getName(), last.getResults().size()));
        }
        insertOpBefore(op, newOps);
        replaceOpWithValues(op, last.getResults());
    }

    public void replaceOp(Operation op, Operation... newOps) {
        replaceOp(op, Arrays.asList(newOps));
    }

    public void replaceMatchedOp(List<Operation> newOps) {
        replaceOp(matchedOp, newOps);
    }

    public void replaceMatchedOp(Operation... newOps) {
        replaceOp(matchedOp, Arrays.asList(newOps));
    }

    /**
     * Replace the results of an operation with existing values, and erase it.
     *
     * @param op     The operation.
     * @param values The values, one per result.
     */
    public void replaceOpWithValues(Operation op, List<? extends Value> values) {
        if (values.size() != op.getResults().size()) {
            throw new IllegalArgumentException(String.format("%s has %d result(s), got %d replacement(s)",
                    op.describe(), op.getResults().size(), values.size()));
        }
        for (int i = 0; i < values.size(); i++) {
            replaceAllUsesWith(op.getResult(i), values.get(i));
        }
        eraseOp(op);
    }

    public void replaceAllUsesWith(Value from, Value to) {
        if (from == to) return;
        modified.addAll(from.getUsers());
        from.replaceAllUsesWith(to);
        hasDoneAction = true;
    }

    public void modifyOperand(Operation op, int index, Value value) {
        op.setOperand(index, value);
        modified.add(op);
        hasDoneAction = true;
    }

    /**
     * Erase an operation, which must have no used results.
     *
     * @param op The operation.
     * @throws IllegalStateException If a result of the operation is still used.
     */
    public void eraseOp(Operation op) {
        op.erase();
        added.remove(op);
        modified.remove(op);
        hasDoneAction = true;
    }

    public void eraseMatchedOp() {
        eraseOp(matchedOp);
    }
}
