package io.github.eutro.irkit.attr;

import java.util.Objects;

/**
 * An integer constant of an {@link IntegerType} or the {@link IndexType}.
 * <p>
 * Values of integer types are stored wrapped to the type's width.
 */
public final class IntegerAttr implements Attribute {
    private final long value;
    private final TypeAttribute type;

    public IntegerAttr(long value, TypeAttribute type) {
        if (!(type instanceof IntegerType) && !(type instanceof IndexType)) {
            throw new IllegalArgumentException("not an integer type: " + type);
        }
        this.type = type;
        this.value = type instanceof IntegerType ? ((IntegerType) type).wrap(value) : value;
    }

    public static IntegerAttr of(long value, int width) {
        return new IntegerAttr(value, IntegerType.of(width));
    }

    public static IntegerAttr index(long value) {
        return new IntegerAttr(value, IndexType.INSTANCE);
    }

    public long getValue() {
        return value;
    }

    public TypeAttribute getType() {
        return type;
    }

    @Override
    public String getAttrName() {
        return "integer";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerAttr)) return false;
        IntegerAttr that = (IntegerAttr) o;
        return value == that.value && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type);
    }

    @Override
    public String toString() {
        return value + " : " + type;
    }
}
