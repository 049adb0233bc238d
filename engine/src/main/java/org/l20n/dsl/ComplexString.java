package org.l20n.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Interpolated string: "Hello, {{ $name }}"
 *
 * @param content Literal spans (StringLiteral) and placeable expressions, in order
 */
public record ComplexString(List<Node> content) implements Node {
    public ComplexString {
        Objects.requireNonNull(content, "Content cannot be null");
        content = List.copyOf(content);
    }

    public static ComplexString of(Node... content) {
        return new ComplexString(List.of(content));
    }
}
