package org.l20n.dsl;

import java.util.Objects;

/**
 * Member of a hash literal: one: "file"
 *
 * @param id        The key used for branch selection
 * @param value     The branch value
 * @param isDefault Whether the pair was marked with *
 */
public record KeyValuePair(String id, Node value, boolean isDefault) implements Node {
    public KeyValuePair {
        Objects.requireNonNull(id, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public static KeyValuePair of(String id, Node value) {
        return new KeyValuePair(id, value, false);
    }

    public static KeyValuePair defaultOf(String id, Node value) {
        return new KeyValuePair(id, value, true);
    }
}
