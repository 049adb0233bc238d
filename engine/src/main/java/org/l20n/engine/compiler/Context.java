package org.l20n.engine.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-owned, read-only environment of a lookup.
 *
 * Identifiers resolve against {@code entries} (normally the compiled resource
 * itself), globals against {@code globals}. The compiler never keeps a context
 * beyond the call it was passed to.
 */
public record Context(Map<String, Value> entries, Map<String, Value> globals) {

    private static final Context EMPTY = new Context(Map.of(), Map.of());

    public Context {
        Objects.requireNonNull(entries, "Entries cannot be null");
        Objects.requireNonNull(globals, "Globals cannot be null");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        globals = Collections.unmodifiableMap(new LinkedHashMap<>(globals));
    }

    public static Context empty() {
        return EMPTY;
    }

    /**
     * Context exposing a resource's entries and the given globals
     * (plain Java values are converted with {@link Values#of(Object)}).
     */
    public static Context of(CompiledResource resource, Map<String, ?> globals) {
        return new Context(resource.entries(), Values.ofMap(globals));
    }

    public static Context ofGlobals(Map<String, ?> globals) {
        return new Context(Map.of(), Values.ofMap(globals));
    }

    public Value lookup(String name) {
        Value value = entries.get(name);
        return value != null ? value : Value.undefined();
    }

    public Value global(String name) {
        Value value = globals.get(name);
        return value != null ? value : Value.undefined();
    }
}
