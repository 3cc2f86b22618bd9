package io.github.eutro.irkit.match;

import io.github.eutro.irkit.attr.Attribute;

/**
 * Requires that an attribute variable is bound to a given attribute.
 */
public class AttributeValueConstraint implements Constraint {
    private final AttributeVariable var;
    private final Attribute value;

    public AttributeValueConstraint(AttributeVariable var, Attribute value) {
        this.var = var;
        this.value = value;
    }

    @Override
    public boolean match(MatchContext ctx) {
        return value.equals(var.get(ctx));
    }

    @Override
    public String toString() {
        return var.getName() + " == " + value;
    }
}
