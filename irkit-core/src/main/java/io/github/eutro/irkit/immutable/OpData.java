package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.OpKind;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The name, kind and attributes of an {@link IOp}, shared between an operation
 * and the operations rebuilt from it.
 */
public final class OpData {
    private final String name;
    private final OpKind kind;
    private final Map<String, Attribute> attributes;

    public OpData(OpKind kind, Map<String, ? extends Attribute> attributes) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = kind.getName();
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getName() {
        return name;
    }

    public OpKind getKind() {
        return kind;
    }

    public Map<String, Attribute> getAttributes() {
        return attributes;
    }

    @Nullable
    public Attribute getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public String toString() {
        return attributes.isEmpty() ? name : name + " " + attributes;
    }
}
