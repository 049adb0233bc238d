package org.l20n.engine.compiler;

import org.l20n.dsl.MacroDefinition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled macro. Each call binds the arguments positionally into fresh locals;
 * the body never sees the caller's locals. Missing arguments are bound to
 * undefined, extra arguments are ignored.
 */
public final class Macro implements Value {

    private final String id;
    private final List<String> parameters;
    private final Evaluator body;
    private final CompilerOptions options;

    Macro(MacroDefinition definition, ExpressionCompiler compiler) {
        this.id = definition.id();
        this.parameters = List.copyOf(definition.args());
        this.body = compiler.compile(definition.expression());
        this.options = compiler.options();
    }

    public String id() {
        return id;
    }

    public List<String> parameters() {
        return parameters;
    }

    /**
     * Calls the macro from outside a resolution, converting plain Java arguments
     * with {@link Values#of(Object)}.
     */
    public Value call(Context context, CallerData data, Object... args) {
        List<Value> values = new ArrayList<>(args.length);
        for (Object arg : args) {
            values.add(Values.of(arg));
        }
        return invoke(values, new ResolutionScope(context, data, options));
    }

    Value invoke(List<Value> args, ResolutionScope scope) {
        Map<String, Value> bindings = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            bindings.put(parameters.get(i), i < args.size() ? args.get(i) : Value.undefined());
        }
        scope.enter("macro '" + id + "'");
        try {
            return body.evaluate(Locals.forMacro(bindings), scope, IndexCursor.empty());
        } finally {
            scope.exit();
        }
    }

    @Override
    public String toString() {
        return "Macro[" + id + "(" + String.join(", ", parameters) + ")]";
    }
}
