package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An SSA value, either an {@link OpResult} or a {@link BlockArgument}.
 * <p>
 * Each value tracks its uses, in the order they were created.
 */
public abstract class Value extends ExtHolder {
    private final Attribute type;
    private final List<Use> uses = new ArrayList<>();

    Value(Attribute type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Attribute getType() {
        return type;
    }

    public List<Use> getUses() {
        return Collections.unmodifiableList(uses);
    }

    public boolean hasUses() {
        return !uses.isEmpty();
    }

    /**
     * Get the distinct operations using this value, in order of first use.
     *
     * @return The users.
     */
    public List<Operation> getUsers() {
        Set<Operation> users = new LinkedHashSet<>();
        for (Use use : uses) {
            users.add(use.getUser());
        }
        return new ArrayList<>(users);
    }

    void addUse(Use use) {
        uses.add(use);
    }

    void removeUse(Use use) {
        if (!uses.remove(use)) {
            throw new IllegalStateException(String.format("%s is not used by %s", describe(), use));
        }
    }

    /**
     * Redirect every use of this value to {@code replacement}.
     *
     * @param replacement The new value.
     */
    public void replaceAllUsesWith(Value replacement) {
        if (replacement == this) return;
        for (Use use : new ArrayList<>(uses)) {
            use.getUser().setOperand(use.getIndex(), replacement);
        }
    }

    /**
     * Get the operation defining this value.
     *
     * @return The defining operation, or null for block arguments.
     */
    @Nullable
    public abstract Operation getDefiningOp();

    /**
     * Get a printable reference to this value, stable across runs.
     *
     * @return The reference.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }
}
