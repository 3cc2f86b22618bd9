package io.github.eutro.irkit.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Checks that keep the op / region / block containment a tree.
 */
final class Ownership {
    private Ownership() {
    }

    @Nullable
    static Object parentOf(Object node) {
        if (node instanceof Operation) return ((Operation) node).getParentBlock();
        if (node instanceof Block) return ((Block) node).getParentRegion();
        if (node instanceof Region) return ((Region) node).getParentOp();
        throw new IllegalArgumentException("not an IR node: " + node);
    }

    static String describe(Object node) {
        if (node instanceof Operation) return ((Operation) node).describe();
        if (node instanceof Block) return ((Block) node).describe();
        if (node instanceof Region) return ((Region) node).describe();
        return String.valueOf(node);
    }

    static void checkInsertion(Object child, Object newParent) {
        Object currentParent = parentOf(child);
        if (currentParent != null) {
            throw new IllegalStateException(String.format("%s is already owned by %s",
                    describe(child), describe(currentParent)));
        }
        for (Object node = newParent; node != null; node = parentOf(node)) {
            if (node == child) {
                throw new IllegalStateException(String.format("%s cannot be inserted into its own descendant %s",
                        describe(child), describe(newParent)));
            }
        }
    }
}
