package org.l20n.dsl;

import java.util.Objects;

/**
 * Plain string without placeables, also used for the literal spans of a ComplexString.
 */
public record StringLiteral(String content) implements Node {
    public StringLiteral {
        Objects.requireNonNull(content, "String content cannot be null");
    }
}
