package org.l20n.engine.compiler;

/**
 * Drives a value to its final text: entities and attributes are resolved,
 * thunks are invoked with an empty cursor, until a primitive results.
 */
final class TextResolver {

    private TextResolver() {
    }

    static String toText(Value value, ResolutionScope scope) {
        Value current = value;
        int maxSteps = scope.options().maxDriveSteps();
        for (int step = 0; ; step++) {
            String text = Values.keyOf(current);
            if (text != null) {
                return text;
            }
            if (current instanceof Value.Undefined) {
                if (scope.options().undefinedInText() == CompilerOptions.UndefinedPolicy.EMPTY) {
                    return "";
                }
                throw new TypeMismatchException("Cannot interpolate an undefined value");
            }
            if (current instanceof Macro macro) {
                throw new TypeMismatchException("Cannot interpolate " + Values.describe(macro) + " without calling it");
            }
            if (step >= maxSteps) {
                throw new CyclicReferenceException("Value did not resolve to text within " + maxSteps + " steps");
            }
            current = step(current, scope);
        }
    }

    /**
     * Evaluates a selector key. Keys that are entities or branches are reduced
     * to text first; undefined stays undefined and selects the default branch.
     */
    static Value toKey(Evaluator key, Locals locals, ResolutionScope scope) {
        Value value = key.evaluate(locals, scope, IndexCursor.empty());
        if (value instanceof Entity || value instanceof Value.Thunk || value instanceof Value.AttributeRef) {
            return Value.str(toText(value, scope));
        }
        return value;
    }

    private static Value step(Value current, ResolutionScope scope) {
        if (current instanceof Entity entity) {
            return entity.resolve(scope, null);
        }
        if (current instanceof Value.AttributeRef ref) {
            return ref.resolve(scope, null);
        }
        if (current instanceof Value.Thunk thunk) {
            return thunk.invoke(scope, IndexCursor.empty());
        }
        throw new TypeMismatchException("Cannot convert " + Values.describe(current) + " to text");
    }
}
