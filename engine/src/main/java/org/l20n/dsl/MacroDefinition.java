package org.l20n.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Macro definition: &lt;plural($n) { $n == 1 ? "one" : "many" }&gt;
 *
 * @param id         The macro id
 * @param args       Parameter names in declaration order (without the $ prefix)
 * @param expression The macro body
 */
public record MacroDefinition(String id, List<String> args, Node expression) implements Node {
    public MacroDefinition {
        Objects.requireNonNull(id, "Macro id cannot be null");
        Objects.requireNonNull(expression, "Macro body cannot be null");
        args = args != null ? List.copyOf(args) : List.of();
    }
}
