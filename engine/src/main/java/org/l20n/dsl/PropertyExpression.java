package org.l20n.dsl;

import java.util.Objects;

/**
 * Member access on an entity or selector: brandName.nominative, plural[$n]
 *
 * @param expression The base expression
 * @param property   An Identifier naming the member, or any expression when computed
 * @param computed   Whether the member was written in brackets
 */
public record PropertyExpression(
        Node expression,
        Node property,
        boolean computed) implements Node {
    public PropertyExpression {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(property, "Property cannot be null");
        if (!computed && !(property instanceof Identifier)) {
            throw new IllegalArgumentException("Non-computed property must be an identifier: " + property);
        }
    }

    public static PropertyExpression of(Node expression, String member) {
        return new PropertyExpression(expression, new Identifier(member), false);
    }
}
