package org.l20n.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Macro call: plural($n)
 */
public record CallExpression(Node callee, List<Node> arguments) implements Node {
    public CallExpression {
        Objects.requireNonNull(callee, "Callee cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments = List.copyOf(arguments);
    }

    public static CallExpression of(Node callee, Node... arguments) {
        return new CallExpression(callee, List.of(arguments));
    }
}
