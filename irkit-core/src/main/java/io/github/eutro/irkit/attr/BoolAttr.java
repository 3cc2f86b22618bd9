package io.github.eutro.irkit.attr;

public final class BoolAttr implements Attribute {
    public static final BoolAttr TRUE = new BoolAttr(true);
    public static final BoolAttr FALSE = new BoolAttr(false);

    private final boolean value;

    private BoolAttr(boolean value) {
        this.value = value;
    }

    public static BoolAttr of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getAttrName() {
        return "bool";
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
