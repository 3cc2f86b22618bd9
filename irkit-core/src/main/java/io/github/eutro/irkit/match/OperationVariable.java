package io.github.eutro.irkit.match;

import io.github.eutro.irkit.ir.Operation;

/**
 * A variable binding an operation.
 */
public class OperationVariable extends Variable<Operation> {
    public OperationVariable(String name) {
        super(name, Operation.class);
    }
}
