package io.github.eutro.irkit.attr;

/**
 * An immutable compile-time value attached to an operation, or used as the type of a value.
 * <p>
 * Attributes have value semantics: implementations must implement
 * {@link Object#equals(Object)} and {@link Object#hashCode()} structurally.
 */
public interface Attribute {
    /**
     * Get the name of this attribute's kind, for instance {@code "integer_type"}.
     *
     * @return The kind name.
     */
    String getAttrName();
}
