package org.l20n.engine.compiler;

import java.util.List;

/**
 * Interpolated string. Every part is driven to text and the parts are joined
 * without separator. Re-entering the same compiled string within one
 * resolution is a cyclic reference.
 */
final class ComplexStringEvaluator implements Evaluator {

    private final List<Evaluator> content;

    ComplexStringEvaluator(List<Evaluator> content) {
        this.content = List.copyOf(content);
    }

    @Override
    public Value evaluate(Locals locals, ResolutionScope scope, IndexCursor index) {
        scope.enterInterpolation(this, locals.self() != null
                ? "entity '" + locals.self().id() + "'"
                : "an interpolated string");
        try {
            StringBuilder sb = new StringBuilder();
            for (Evaluator part : content) {
                sb.append(TextResolver.toText(part.evaluate(locals, scope, IndexCursor.empty()), scope));
            }
            return Value.str(sb.toString());
        } finally {
            scope.exitInterpolation(this);
        }
    }
}
