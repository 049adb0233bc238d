package org.l20n.dsl;

import java.util.Objects;

/**
 * Binary expression: left op right (e.g., $n == 1, $n % 10, $a + $b)
 */
public record BinaryExpression(
        Node left,
        String operator,
        Node right) implements Node {
    public BinaryExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }
}
