package io.github.eutro.irkit.attr;

/**
 * A fixed-width two's complement integer type, {@code i<width>}.
 */
public final class IntegerType implements TypeAttribute {
    public static final IntegerType I1 = new IntegerType(1);
    public static final IntegerType I8 = new IntegerType(8);
    public static final IntegerType I16 = new IntegerType(16);
    public static final IntegerType I32 = new IntegerType(32);
    public static final IntegerType I64 = new IntegerType(64);

    private final int width;

    private IntegerType(int width) {
        this.width = width;
    }

    public static IntegerType of(int width) {
        switch (width) {
            case 1:
                return I1;
            case 8:
                return I8;
            case 16:
                return I16;
            case 32:
                return I32;
            case 64:
                return I64;
        }
        if (width < 1 || width > 64) {
            throw new IllegalArgumentException("unsupported integer width: " + width);
        }
        return new IntegerType(width);
    }

    public int getWidth() {
        return width;
    }

    /**
     * Wrap a value to this type's width, sign-extending the result.
     *
     * @param value The value.
     * @return The wrapped value.
     */
    public long wrap(long value) {
        if (width == 64) return value;
        int shift = 64 - width;
        return (value << shift) >> shift;
    }

    /**
     * Reinterpret a (wrapped) value as unsigned, zero-extending it.
     *
     * @param value The value.
     * @return The value as an unsigned 64 bit integer.
     */
    public long toUnsigned(long value) {
        if (width == 64) return value;
        return value & ((1L << width) - 1);
    }

    @Override
    public String getAttrName() {
        return "integer_type";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof IntegerType && ((IntegerType) o).width == width;
    }

    @Override
    public int hashCode() {
        return width;
    }

    @Override
    public String toString() {
        return "i" + width;
    }
}
