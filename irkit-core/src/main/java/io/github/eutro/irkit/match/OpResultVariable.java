package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.OpResult;

/**
 * A variable binding an operation result.
 */
public class OpResultVariable extends Variable<OpResult> {
    public OpResultVariable(String name) {
        super(name, OpResult.class);
    }
}
