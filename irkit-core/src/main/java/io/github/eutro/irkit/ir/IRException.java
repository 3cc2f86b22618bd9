package io.github.eutro.irkit.ir;

/**
 * The root of the exceptions raised by the IR core for malformed IR.
 */
public class IRException extends RuntimeException {
    public IRException(String message) {
        super(message);
    }

    public IRException(String message, Throwable cause) {
        super(message, cause);
    }
}
