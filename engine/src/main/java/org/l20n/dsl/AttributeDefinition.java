package org.l20n.dsl;

import java.util.Objects;

/**
 * Attribute definition inside an entity: title: "Settings"
 */
public record AttributeDefinition(String id, Node value, boolean local) implements Node {
    public AttributeDefinition {
        Objects.requireNonNull(id, "Attribute id cannot be null");
        Objects.requireNonNull(value, "Attribute value cannot be null");
    }

    public static AttributeDefinition of(String id, Node value) {
        return new AttributeDefinition(id, value, false);
    }
}
