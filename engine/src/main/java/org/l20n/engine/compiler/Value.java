package org.l20n.engine.compiler;

import java.util.Objects;

/**
 * Runtime value produced by compiled evaluators.
 *
 * Variants:
 * - Str, Num, Bool: primitive values
 * - Entity, AttributeRef, Macro: references to compiled entries
 * - Thunk: a selected but not yet evaluated selector branch
 * - Undefined: the result of looking up a missing name
 */
public sealed interface Value
        permits Value.Str, Value.Num, Value.Bool, Value.Undefined, Value.Thunk, Value.AttributeRef,
        Entity, Macro {

    static Str str(String value) {
        return new Str(value);
    }

    static Num num(double value) {
        return new Num(value);
    }

    static Bool bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Undefined undefined() {
        return Undefined.INSTANCE;
    }

    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "String value cannot be null");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Num(double value) implements Value {
        @Override
        public String toString() {
            return Values.formatNumber(value);
        }
    }

    record Bool(boolean value) implements Value {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    enum Undefined implements Value {
        INSTANCE;

        @Override
        public String toString() {
            return "undefined";
        }
    }

    /**
     * A selector branch picked in yield mode. Invoking it evaluates the branch
     * under the locals it was selected with, consuming the given cursor.
     */
    record Thunk(Evaluator branch, Locals locals) implements Value {
        public Thunk {
            Objects.requireNonNull(branch, "Branch cannot be null");
            Objects.requireNonNull(locals, "Locals cannot be null");
        }

        public Value invoke(ResolutionScope scope, IndexCursor index) {
            return branch.evaluate(locals, scope, index);
        }
    }

    /**
     * An attribute together with the entity that owns it, produced by
     * {@code entity::attr} when used as the base of a member access.
     */
    record AttributeRef(Entity owner, Attribute attribute) implements Value {
        public AttributeRef {
            Objects.requireNonNull(owner, "Owner cannot be null");
            Objects.requireNonNull(attribute, "Attribute cannot be null");
        }

        public Value yield(ResolutionScope scope, IndexCursor index) {
            return attribute.yield(owner, scope, index);
        }

        public Value resolve(ResolutionScope scope, IndexCursor index) {
            return attribute.resolve(owner, scope, index);
        }
    }
}
