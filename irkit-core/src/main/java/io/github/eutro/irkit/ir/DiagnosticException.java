package io.github.eutro.irkit.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A failure attributable to a specific operation, such as an attribute of the wrong kind,
 * or a case a dialect does not handle.
 * <p>
 * If {@link Operation#TRACK_OP_CREATIONS} was set when the operation was created,
 * the trace of its construction is attached as a suppressed exception.
 */
public class DiagnosticException extends IRException {
    @Nullable
    private final transient Operation op;

    public DiagnosticException(@Nullable Operation op, String message) {
        super(op == null ? message : op.describe() + ": " + message);
        this.op = op;
        if (op != null && op.created != null) {
            addSuppressed(op.created);
        }
    }

    /**
     * Get the operation this diagnostic is about.
     *
     * @return The operation, or null if there was none.
     */
    @Nullable
    public Operation getOperation() {
        return op;
    }
}
