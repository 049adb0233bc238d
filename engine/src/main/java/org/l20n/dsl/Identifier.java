package org.l20n.dsl;

import java.util.Objects;

/**
 * Reference to another entry of the resource, resolved late against the context.
 *
 * Example: {{ brandName }}
 *
 * @param name The entry id
 */
public record Identifier(String name) implements Node {
    public Identifier {
        Objects.requireNonNull(name, "Identifier name cannot be null");
    }
}
