package org.l20n.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Hash selector literal: {one: "file", *many: "files"}
 *
 * The default branch is the last pair marked as default, or the first pair when
 * none is marked.
 */
public record HashLiteral(List<KeyValuePair> content) implements Node {
    public HashLiteral {
        Objects.requireNonNull(content, "Content cannot be null");
        content = List.copyOf(content);
    }

    public static HashLiteral of(KeyValuePair... content) {
        return new HashLiteral(List.of(content));
    }
}
