package io.github.eutro.irkit.ir;

/**
 * Thrown by an {@link OpVerifier} when an operation does not satisfy the rules of its kind.
 */
public class VerifyException extends DiagnosticException {
    public VerifyException(Operation op, String message) {
        super(op, message);
    }
}
