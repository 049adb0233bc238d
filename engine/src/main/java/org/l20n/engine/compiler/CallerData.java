package org.l20n.engine.compiler;

import java.util.Map;
import java.util.Objects;

/**
 * Per-call variable overrides supplied by the caller, consulted by {@code $name}
 * lookups when no local binding exists.
 */
public record CallerData(Map<String, Value> variables) {

    private static final CallerData EMPTY = new CallerData(Map.of());

    public CallerData {
        Objects.requireNonNull(variables, "Variables cannot be null");
        variables = Map.copyOf(variables);
    }

    public static CallerData empty() {
        return EMPTY;
    }

    /**
     * Converts plain Java values with {@link Values#of(Object)}.
     */
    public static CallerData of(Map<String, ?> variables) {
        return new CallerData(Values.ofMap(variables));
    }

    public Value lookup(String name) {
        Value value = variables.get(name);
        return value != null ? value : Value.undefined();
    }
}
