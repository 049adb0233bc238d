package org.l20n.engine.compiler;

import org.l20n.dsl.AttributeDefinition;

/**
 * Compiled attribute of an entity.
 *
 * The owning entity is not stored; it is passed in on every call and bound as
 * {@code this}. Without an explicit index the owner's default index applies.
 */
public final class Attribute {

    private final String id;
    private final Evaluator value;
    private final boolean local;

    Attribute(AttributeDefinition definition, ExpressionCompiler compiler) {
        this.id = definition.id();
        this.value = compiler.compile(definition.value());
        this.local = definition.local();
    }

    public String id() {
        return id;
    }

    public boolean isLocal() {
        return local;
    }

    Value yield(Entity owner, ResolutionScope scope, IndexCursor index) {
        return evaluate(owner, scope, index, false);
    }

    Value resolve(Entity owner, ResolutionScope scope, IndexCursor index) {
        return evaluate(owner, scope, index, true);
    }

    private Value evaluate(Entity owner, ResolutionScope scope, IndexCursor index, boolean resolve) {
        scope.enter("attribute '" + owner.id() + "::" + id + "'");
        try {
            return value.evaluate(Locals.forEntity(owner, resolve), scope,
                    index != null ? index : owner.defaultIndex());
        } finally {
            scope.exit();
        }
    }

    @Override
    public String toString() {
        return "Attribute[" + id + "]";
    }
}
