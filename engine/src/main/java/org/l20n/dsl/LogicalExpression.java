package org.l20n.dsl;

import java.util.Objects;

/**
 * Logical expression: left && right, left || right.
 *
 * The parser also emits this node with a null operator and right operand for a
 * bare operand; it then stands for {@code left} alone.
 */
public record LogicalExpression(
        Node left,
        String operator,
        Node right) implements Node {
    public LogicalExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        if (operator != null) {
            Objects.requireNonNull(right, "Right operand cannot be null");
        }
    }

    public static LogicalExpression of(Node operand) {
        return new LogicalExpression(operand, null, null);
    }
}
