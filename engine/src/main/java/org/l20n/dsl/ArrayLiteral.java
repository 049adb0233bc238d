package org.l20n.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Array selector literal: ["one", "many"]
 *
 * @param content      The branches in source order
 * @param defaultIndex Position of the default branch (0 unless one is marked with *)
 */
public record ArrayLiteral(List<Node> content, int defaultIndex) implements Node {
    public ArrayLiteral {
        Objects.requireNonNull(content, "Content cannot be null");
        content = List.copyOf(content);
        if (!content.isEmpty() && (defaultIndex < 0 || defaultIndex >= content.size())) {
            throw new IllegalArgumentException("Default index " + defaultIndex + " out of range for " + content.size() + " branches");
        }
    }

    public static ArrayLiteral of(Node... content) {
        return new ArrayLiteral(List.of(content), 0);
    }
}
