package io.github.eutro.irkit.match;

import io.github.eutro.irkit.attr.Attribute;

/**
 * Binds an attribute of an operation. Fails if the operation has no such attribute.
 */
public class OperationAttributeConstraint implements Constraint {
    private final OperationVariable opVar;
    private final String attrName;
    private final AttributeVariable attrVar;

    public OperationAttributeConstraint(OperationVariable opVar, String attrName, AttributeVariable attrVar) {
        this.opVar = opVar;
        this.attrName = attrName;
        this.attrVar = attrVar;
    }

    @Override
    public boolean match(MatchContext ctx) {
        Attribute attr = opVar.get(ctx).getAttribute(attrName);
        return attr != null && attrVar.set(ctx, attr);
    }

    @Override
    public String toString() {
        return attrVar.getName() + " = " + opVar.getName() + "[" + attrName + "]";
    }
}
