package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.Value;

/**
 * A variable binding any SSA value.
 */
public class ValueVariable extends Variable<Value> {
    public ValueVariable(String name) {
        super(name, Value.class);
    }
}
