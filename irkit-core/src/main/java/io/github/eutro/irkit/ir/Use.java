package io.github.eutro.irkit.ir;

/**
 * One use of a {@link Value}: the operand slot {@code index} of {@code user}.
 */
public final class Use {
    private final Operation user;
    private final int index;

    public Use(Operation user, int index) {
        this.user = user;
        this.index = index;
    }

    public Operation getUser() {
        return user;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Use)) return false;
        Use use = (Use) o;
        return user == use.user && index == use.index;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(user) * 31 + index;
    }

    @Override
    public String toString() {
        return "operand#" + index + " of " + user.describe();
    }
}
