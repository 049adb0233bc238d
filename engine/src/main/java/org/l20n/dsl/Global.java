package org.l20n.dsl;

import java.util.Objects;

/**
 * Global variable reference: @hour, @os
 *
 * @param name The global name (without the @ prefix)
 */
public record Global(String name) implements Node {
    public Global {
        Objects.requireNonNull(name, "Global name cannot be null");
    }
}
