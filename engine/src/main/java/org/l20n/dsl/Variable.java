package org.l20n.dsl;

import java.util.Objects;

/**
 * Variable reference: macro parameter or caller-supplied data.
 *
 * Example: $n, $user
 *
 * @param name The variable name (without the $ prefix)
 */
public record Variable(String name) implements Node {
    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }
}
