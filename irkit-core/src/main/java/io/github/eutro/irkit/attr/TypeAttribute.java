package io.github.eutro.irkit.attr;

/**
 * An attribute which may be used as the type of a value.
 */
public interface TypeAttribute extends Attribute {
}
