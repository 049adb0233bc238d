package org.l20n.dsl;

import java.util.Objects;

/**
 * Unary expression: -x, +x, !x
 */
public record UnaryExpression(String operator, Node operand) implements Node {
    public UnaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }
}
