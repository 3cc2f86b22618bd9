package io.github.eutro.irkit.attr;

/**
 * An attribute whose presence is its only information.
 */
public final class UnitAttr implements Attribute {
    public static final UnitAttr INSTANCE = new UnitAttr();

    private UnitAttr() {
    }

    @Override
    public String getAttrName() {
        return "unit";
    }

    @Override
    public String toString() {
        return "unit";
    }
}
