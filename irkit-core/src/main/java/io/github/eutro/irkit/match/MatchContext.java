package io.github.eutro.irkit.match;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The bindings of query variables during one match attempt.
 */
public final class MatchContext {
    private final Map<String, Object> bindings = new LinkedHashMap<>();

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    @Nullable
    public Object lookup(String name) {
        return bindings.get(name);
    }

    void bind(String name, Object value) {
        bindings.put(name, value);
    }

    public Map<String, Object> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
