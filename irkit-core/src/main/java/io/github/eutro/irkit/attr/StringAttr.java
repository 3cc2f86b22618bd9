package io.github.eutro.irkit.attr;

import java.util.Objects;

public final class StringAttr implements Attribute {
    private final String value;

    public StringAttr(String value) {
        this.value = Objects.requireNonNull(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getAttrName() {
        return "string";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof StringAttr && ((StringAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
