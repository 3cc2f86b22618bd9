package io.github.eutro.irkit.match;

import io.github.eutro.irkit.attr.Attribute;

/**
 * A variable binding an attribute.
 */
public class AttributeVariable extends Variable<Attribute> {
    public AttributeVariable(String name) {
        super(name, Attribute.class);
    }
}
