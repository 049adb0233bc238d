package org.l20n.engine.compiler;

import java.util.Map;

/**
 * Bindings of one invocation: the active entity ({@code this}), the resolve-mode
 * flag and macro parameters.
 *
 * Locals are immutable and created fresh for every entity, attribute and macro
 * invocation, so they are never shared across unrelated resolutions.
 *
 * @param self     The entity being resolved, or null inside a macro
 * @param resolve  True to drive selected branches to a final value, false to yield thunks
 * @param bindings Macro parameter bindings
 */
public record Locals(Entity self, boolean resolve, Map<String, Value> bindings) {

    public Locals {
        bindings = bindings != null ? Map.copyOf(bindings) : Map.of();
    }

    public static Locals forEntity(Entity self, boolean resolve) {
        return new Locals(self, resolve, Map.of());
    }

    public static Locals forMacro(Map<String, Value> bindings) {
        return new Locals(null, false, bindings);
    }

    /**
     * @return The local binding, or null when the name is not bound
     */
    public Value lookup(String name) {
        return bindings.get(name);
    }
}
