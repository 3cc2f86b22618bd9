package io.github.eutro.irkit.match;

import java.util.Objects;

/**
 * A named placeholder in a {@link Query}, bound to an IR entity while matching.
 *
 * @param <T> The type of entity the variable binds.
 */
public abstract class Variable<T> {
    private final String name;
    private final Class<T> type;

    protected Variable(String name, Class<T> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * Read the binding of this variable.
     *
     * @param ctx The match context.
     * @return The bound entity.
     * @throws IllegalStateException If the variable is not bound, which means a constraint
     *                               reading it was placed before the one binding it.
     */
    public T get(MatchContext ctx) {
        if (!ctx.isBound(name)) {
            throw new IllegalStateException("variable '" + name + "' is read before it is bound");
        }
        return type.cast(ctx.lookup(name));
    }

    public boolean isBound(MatchContext ctx) {
        return ctx.isBound(name);
    }

    /**
     * Bind this variable, or if it is already bound, check that the binding equals {@code value}.
     *
     * @param ctx   The match context.
     * @param value The entity.
     * @return Whether the binding is consistent.
     */
    public boolean set(MatchContext ctx, T value) {
        Objects.requireNonNull(value, "value");
        if (ctx.isBound(name)) {
            return value.equals(ctx.lookup(name));
        }
        ctx.bind(name, value);
        return true;
    }

    /**
     * Like {@link #set(MatchContext, Object)}, but fails instead if {@code value} is not
     * of this variable's type, or is null.
     *
     * @param ctx   The match context.
     * @param value The entity.
     * @return Whether the binding is consistent.
     */
    public boolean trySet(MatchContext ctx, Object value) {
        if (!type.isInstance(value)) return false;
        return set(ctx, type.cast(value));
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
