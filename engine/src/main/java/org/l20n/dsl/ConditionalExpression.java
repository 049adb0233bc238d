package org.l20n.dsl;

import java.util.Objects;

/**
 * Conditional expression: test ? consequent : alternate
 */
public record ConditionalExpression(Node test, Node consequent, Node alternate) implements Node {
    public ConditionalExpression {
        Objects.requireNonNull(test, "Test cannot be null");
        Objects.requireNonNull(consequent, "Consequent cannot be null");
        Objects.requireNonNull(alternate, "Alternate cannot be null");
    }
}
