package org.l20n.engine.compiler;

/**
 * A compiled syntax node. Produced once by {@link ExpressionCompiler} and reused
 * for every resolution that reaches the node.
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * @param locals Bindings of the current invocation ({@code this}, resolve flag, macro parameters)
     * @param scope  The resolution the evaluation belongs to
     * @param index  Selector keys still to be consumed, left to right
     */
    Value evaluate(Locals locals, ResolutionScope scope, IndexCursor index);

    static Evaluator constant(Value value) {
        return (locals, scope, index) -> value;
    }
}
