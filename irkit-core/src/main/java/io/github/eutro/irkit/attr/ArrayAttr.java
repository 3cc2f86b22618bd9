package io.github.eutro.irkit.attr;

import io.github.eutro.irkit.util.SealedList;

import java.util.List;
import java.util.stream.Collectors;

public final class ArrayAttr implements Attribute {
    private final SealedList<Attribute> elements;

    public ArrayAttr(List<? extends Attribute> elements) {
        this.elements = SealedList.of(elements);
    }

    public static ArrayAttr of(Attribute... elements) {
        return new ArrayAttr(SealedList.of(elements));
    }

    public SealedList<Attribute> getElements() {
        return elements;
    }

    @Override
    public String getAttrName() {
        return "array";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ArrayAttr && ((ArrayAttr) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
