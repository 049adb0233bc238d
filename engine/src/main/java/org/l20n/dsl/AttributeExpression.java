package org.l20n.dsl;

import java.util.Objects;

/**
 * Attribute access on an entity: brandName::title, ~::accesskey
 *
 * @param expression The expression evaluating to the owning entity
 * @param attribute  An Identifier naming the attribute, or any expression when computed
 * @param computed   Whether the attribute name was written in brackets
 */
public record AttributeExpression(
        Node expression,
        Node attribute,
        boolean computed) implements Node {
    public AttributeExpression {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(attribute, "Attribute cannot be null");
        if (!computed && !(attribute instanceof Identifier)) {
            throw new IllegalArgumentException("Non-computed attribute must be an identifier: " + attribute);
        }
    }

    public static AttributeExpression of(Node expression, String attribute) {
        return new AttributeExpression(expression, new Identifier(attribute), false);
    }
}
