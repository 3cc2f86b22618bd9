package io.github.eutro.irkit.ir;

/**
 * Kind-specific checks, run by {@link Operation#verify()}.
 */
@FunctionalInterface
public interface OpVerifier {
    /**
     * Check the operation.
     *
     * @param op The operation.
     * @throws VerifyException If the operation is malformed.
     */
    void verify(Operation op);
}
