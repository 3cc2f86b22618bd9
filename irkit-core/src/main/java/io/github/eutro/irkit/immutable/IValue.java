package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;

import java.util.Objects;

/**
 * An immutable SSA value, either an {@link IResult} or an {@link IBlockArg}.
 */
public abstract class IValue {
    private final Attribute type;

    IValue(Attribute type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Attribute getType() {
        return type;
    }
}
