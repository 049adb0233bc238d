package org.l20n.engine.compiler;

import org.l20n.dsl.AttributeDefinition;
import org.l20n.dsl.EntityDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled entity: a localizable value with an optional default selector
 * index and named attributes.
 *
 * Public lookups ({@link #get}, {@link #getAttribute}, {@link #getAttributes},
 * {@link #getEntity}) each start their own resolution with the caller's
 * context and data. Internally an entity is evaluated in one of two modes:
 * - resolve: selected branches are driven to a final value
 * - yield: the next selected branch is returned as an unevaluated thunk,
 *   which is what member access (entity.member) builds on
 */
public final class Entity implements Value {

    private final String id;
    private final Evaluator value;
    private final List<Evaluator> index;
    private final Map<String, Attribute> attributes;
    private final boolean local;
    private final CompilerOptions options;

    Entity(EntityDefinition definition, ExpressionCompiler compiler) {
        this.id = definition.id();
        this.value = definition.value() != null ? compiler.compile(definition.value()) : null;
        this.index = List.copyOf(compiler.compileAll(definition.index()));
        Map<String, Attribute> attrs = new LinkedHashMap<>();
        for (AttributeDefinition attr : definition.attrs()) {
            attrs.put(attr.id(), new Attribute(attr, compiler));
        }
        this.attributes = Collections.unmodifiableMap(attrs);
        this.local = definition.local();
        this.options = compiler.options();
    }

    public String id() {
        return id;
    }

    public boolean isLocal() {
        return local;
    }

    /**
     * @return False for entities that only carry attributes
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return Attributes by id, in source order
     */
    public Map<String, Attribute> attributes() {
        return attributes;
    }

    // ==================== Public lookups ====================

    /**
     * Resolves the entity value using its default index.
     *
     * @return The text, or null if the entity has no value
     */
    public String get(Context context, CallerData data) {
        return get(context, data, null);
    }

    /**
     * Resolves the entity value.
     *
     * @param index Selector keys; null to use the entity's default index
     * @return The text, or null if the entity has no value
     * @throws CyclicReferenceException if the value refers back to itself
     */
    public String get(Context context, CallerData data, IndexCursor index) {
        if (value == null) {
            return null;
        }
        ResolutionScope scope = new ResolutionScope(context, data, options);
        return TextResolver.toText(resolve(scope, index), scope);
    }

    /**
     * @throws AttributeNotFoundException if the entity has no such attribute
     */
    public String getAttribute(String name, Context context, CallerData data) {
        return resolveAttribute(name, new ResolutionScope(context, data, options));
    }

    /**
     * Resolves every attribute, in source order.
     */
    public Map<String, String> getAttributes(Context context, CallerData data) {
        return resolveAttributes(new ResolutionScope(context, data, options));
    }

    /**
     * Snapshot of the value and all attributes, as handed to UI bindings.
     */
    public EntitySnapshot getEntity(Context context, CallerData data) {
        return new EntitySnapshot(get(context, data), getAttributes(context, data));
    }

    // ==================== Resolution ====================

    IndexCursor defaultIndex() {
        return IndexCursor.ofEvaluators(index);
    }

    Value yield(ResolutionScope scope, IndexCursor index) {
        return evaluate(scope, index, false);
    }

    Value resolve(ResolutionScope scope, IndexCursor index) {
        return evaluate(scope, index, true);
    }

    private Value evaluate(ResolutionScope scope, IndexCursor index, boolean resolve) {
        if (value == null) {
            return Value.undefined();
        }
        scope.enter("entity '" + id + "'");
        try {
            return value.evaluate(Locals.forEntity(this, resolve), scope, index != null ? index : defaultIndex());
        } finally {
            scope.exit();
        }
    }

    Attribute requireAttribute(String name) {
        Attribute attribute = attributes.get(name);
        if (attribute == null) {
            throw new AttributeNotFoundException(id, name);
        }
        return attribute;
    }

    String resolveAttribute(String name, ResolutionScope scope) {
        Attribute attribute = requireAttribute(name);
        return TextResolver.toText(attribute.resolve(this, scope, null), scope);
    }

    private Map<String, String> resolveAttributes(ResolutionScope scope) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Attribute attribute : attributes.values()) {
            resolved.put(attribute.id(), TextResolver.toText(attribute.resolve(this, scope, null), scope));
        }
        return Collections.unmodifiableMap(resolved);
    }

    @Override
    public String toString() {
        return "Entity[" + id + "]";
    }
}
