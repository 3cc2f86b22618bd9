package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.ir.IRException;

/**
 * Thrown when converting between the mutable and immutable IR finds a value
 * or block that was not defined in the part being converted.
 */
public class UnresolvedReferenceException extends IRException {
    public UnresolvedReferenceException(String message) {
        super(message);
    }
}
