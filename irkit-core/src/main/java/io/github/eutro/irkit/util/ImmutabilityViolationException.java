package io.github.eutro.irkit.util;

/**
 * Thrown when something attempts to mutate a sealed IR container.
 */
public class ImmutabilityViolationException extends UnsupportedOperationException {
    public ImmutabilityViolationException(String message) {
        super(message);
    }
}
