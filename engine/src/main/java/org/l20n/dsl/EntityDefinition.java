package org.l20n.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Entity definition: &lt;id[index] value attr: "..."&gt;
 *
 * @param id    The entity id
 * @param value The value expression (may be null for attribute-only entities)
 * @param index Default selector expressions, one per nested selector
 * @param attrs Attribute definitions in source order
 * @param local Whether the id starts with an underscore
 */
public record EntityDefinition(
        String id,
        Node value,
        List<Node> index,
        List<AttributeDefinition> attrs,
        boolean local) implements Node {
    public EntityDefinition {
        Objects.requireNonNull(id, "Entity id cannot be null");
        index = index != null ? List.copyOf(index) : List.of();
        attrs = attrs != null ? List.copyOf(attrs) : List.of();
    }

    public static EntityDefinition of(String id, Node value) {
        return new EntityDefinition(id, value, List.of(), List.of(), false);
    }
}
