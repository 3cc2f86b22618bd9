package io.github.eutro.irkit.match;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The bindings of a successful match, keyed by variable name.
 */
public final class Match {
    private final Map<String, Object> bindings;

    Match(Map<String, Object> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Object get(String name) {
        Object value = bindings.get(name);
        if (value == null) throw new IllegalArgumentException("no variable named '" + name + "'");
        return value;
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public <T> T get(Variable<T> var) {
        return get(var.getName(), var.getType());
    }

    public Operation getRoot() {
        return get(Query.ROOT, Operation.class);
    }

    public Operation getOperation(String name) {
        return get(name, Operation.class);
    }

    public Value getValue(String name) {
        return get(name, Value.class);
    }

    public Attribute getAttribute(String name) {
        return get(name, Attribute.class);
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    public Map<String, Object> asMap() {
        return bindings;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Match && ((Match) o).bindings.equals(bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "Match" + bindings;
    }
}
