package io.github.eutro.irkit.attr;

/**
 * The target-sized integer type used for indices.
 */
public final class IndexType implements TypeAttribute {
    public static final IndexType INSTANCE = new IndexType();

    private IndexType() {
    }

    @Override
    public String getAttrName() {
        return "index";
    }

    @Override
    public String toString() {
        return "index";
    }
}
