package org.l20n.engine.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of compiling one resource: entities and macros by id, in source order.
 */
public final class CompiledResource {

    private final Map<String, Value> entries;

    CompiledResource(Map<String, Value> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * @return Every entry by id; values are {@link Entity} or {@link Macro}
     */
    public Map<String, Value> entries() {
        return entries;
    }

    /**
     * @return The entity or macro, or null if the id is not defined
     */
    public Value get(String id) {
        return entries.get(id);
    }

    public Optional<Entity> findEntity(String id) {
        return entries.get(id) instanceof Entity entity ? Optional.of(entity) : Optional.empty();
    }

    public Optional<Macro> findMacro(String id) {
        return entries.get(id) instanceof Macro macro ? Optional.of(macro) : Optional.empty();
    }

    public Set<String> ids() {
        return entries.keySet();
    }

    /**
     * @return Ids of entities not marked local, in source order
     */
    public List<String> publicIds() {
        List<String> ids = new ArrayList<>();
        entries.forEach((id, value) -> {
            if (value instanceof Entity entity && !entity.isLocal()) {
                ids.add(id);
            }
        });
        return ids;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Context whose identifiers resolve to this resource's entries.
     */
    public Context context(Map<String, ?> globals) {
        return Context.of(this, globals);
    }

    public Context context() {
        return context(Map.of());
    }
}
