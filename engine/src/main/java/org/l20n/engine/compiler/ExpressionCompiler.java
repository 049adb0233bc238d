package org.l20n.engine.compiler;

import org.l20n.dsl.ArrayLiteral;
import org.l20n.dsl.AttributeExpression;
import org.l20n.dsl.BinaryExpression;
import org.l20n.dsl.CallExpression;
import org.l20n.dsl.ComplexString;
import org.l20n.dsl.ConditionalExpression;
import org.l20n.dsl.Global;
import org.l20n.dsl.HashLiteral;
import org.l20n.dsl.Identifier;
import org.l20n.dsl.KeyValuePair;
import org.l20n.dsl.L20nCompileException;
import org.l20n.dsl.LogicalExpression;
import org.l20n.dsl.Node;
import org.l20n.dsl.NumberLiteral;
import org.l20n.dsl.PropertyExpression;
import org.l20n.dsl.StringLiteral;
import org.l20n.dsl.ThisExpression;
import org.l20n.dsl.UnaryExpression;
import org.l20n.dsl.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles L20n expression nodes into evaluators.
 *
 * Compilation is a single recursive pass: container nodes compile their
 * children once and close over the results, so evaluating an entity never
 * touches the syntax tree again.
 *
 * Key behaviors:
 * - Names (identifiers, globals, variables) are looked up at evaluation time
 * - Array and hash literals select exactly one branch per cursor key
 * - Property access yields instead of resolving, so chains like a.b.c only
 *   evaluate the branches they select
 */
public final class ExpressionCompiler {

    private final CompilerOptions options;

    public ExpressionCompiler() {
        this(CompilerOptions.defaults());
    }

    public ExpressionCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Compiles an expression node.
     *
     * @param node The expression node
     * @return The compiled evaluator
     * @throws L20nCompileException if the node (or one of its children) is not an expression
     */
    public Evaluator compile(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");

        // ==================== Primary expressions ====================
        if (node instanceof Identifier identifier) {
            String name = identifier.name();
            return (locals, scope, index) -> scope.context().lookup(name);
        }
        if (node instanceof ThisExpression) {
            return (locals, scope, index) -> locals.self() != null ? locals.self() : Value.undefined();
        }
        if (node instanceof Variable variable) {
            return compileVariable(variable);
        }
        if (node instanceof Global global) {
            String name = global.name();
            return (locals, scope, index) -> scope.context().global(name);
        }
        if (node instanceof NumberLiteral number) {
            return Evaluator.constant(Value.num(number.content()));
        }
        if (node instanceof StringLiteral string) {
            return Evaluator.constant(Value.str(string.content()));
        }
        if (node instanceof ArrayLiteral array) {
            return compileArray(array);
        }
        if (node instanceof HashLiteral hash) {
            return compileHash(hash);
        }
        if (node instanceof ComplexString complex) {
            return new ComplexStringEvaluator(compileAll(complex.content()));
        }
        if (node instanceof KeyValuePair pair) {
            return compile(pair.value());
        }

        // ==================== Operator expressions ====================
        if (node instanceof UnaryExpression unary) {
            UnaryOp operator = UnaryOp.fromToken(unary.operator());
            Evaluator operand = compile(unary.operand());
            return (locals, scope, index) -> operator.apply(operand.evaluate(locals, scope, IndexCursor.empty()));
        }
        if (node instanceof BinaryExpression binary) {
            Evaluator left = compile(binary.left());
            BinaryOp operator = BinaryOp.fromToken(binary.operator());
            Evaluator right = compile(binary.right());
            return (locals, scope, index) -> operator.apply(
                    left.evaluate(locals, scope, IndexCursor.empty()),
                    right.evaluate(locals, scope, IndexCursor.empty()));
        }
        if (node instanceof LogicalExpression logical) {
            return compileLogical(logical);
        }
        if (node instanceof ConditionalExpression conditional) {
            Evaluator test = compile(conditional.test());
            Evaluator consequent = compile(conditional.consequent());
            Evaluator alternate = compile(conditional.alternate());
            return (locals, scope, index) -> Values.isTruthy(test.evaluate(locals, scope, IndexCursor.empty()))
                    ? consequent.evaluate(locals, scope, index)
                    : alternate.evaluate(locals, scope, index);
        }

        // ==================== Member expressions ====================
        if (node instanceof CallExpression call) {
            return compileCall(call);
        }
        if (node instanceof PropertyExpression property) {
            return compileProperty(property);
        }
        if (node instanceof AttributeExpression attribute) {
            return compileAttribute(attribute);
        }

        throw new L20nCompileException("Cannot compile " + node.getClass().getSimpleName() + " as an expression: " + node);
    }

    /**
     * Compiles each node in order.
     */
    public List<Evaluator> compileAll(List<? extends Node> nodes) {
        List<Evaluator> compiled = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            compiled.add(compile(node));
        }
        return compiled;
    }

    // ==================== Primary expressions ====================

    /**
     * Local bindings shadow caller data; a local bound to undefined counts as absent.
     */
    private Evaluator compileVariable(Variable variable) {
        String name = variable.name();
        return (locals, scope, index) -> {
            Value local = locals.lookup(name);
            if (local != null && !(local instanceof Value.Undefined)) {
                return local;
            }
            return scope.data().lookup(name);
        };
    }

    private Evaluator compileArray(ArrayLiteral array) {
        if (array.content().isEmpty()) {
            throw new L20nCompileException("Array literal must have at least one branch");
        }
        return new ArrayLiteralEvaluator(compileAll(array.content()), array.defaultIndex());
    }

    private Evaluator compileHash(HashLiteral hash) {
        if (hash.content().isEmpty()) {
            throw new L20nCompileException("Hash literal must have at least one branch");
        }
        Map<String, Evaluator> content = new LinkedHashMap<>();
        String defaultKey = null;
        for (int i = 0; i < hash.content().size(); i++) {
            KeyValuePair pair = hash.content().get(i);
            content.put(pair.id(), compile(pair));
            if (i == 0 || pair.isDefault()) {
                defaultKey = pair.id();
            }
        }
        return new HashLiteralEvaluator(content, defaultKey);
    }

    // ==================== Operator expressions ====================

    private Evaluator compileLogical(LogicalExpression logical) {
        Evaluator left = compile(logical.left());
        if (logical.operator() == null) {
            return left;
        }
        LogicalOp operator = LogicalOp.fromToken(logical.operator());
        Evaluator right = compile(logical.right());
        return (locals, scope, index) -> operator.apply(
                left.evaluate(locals, scope, IndexCursor.empty()),
                right.evaluate(locals, scope, IndexCursor.empty()));
    }

    // ==================== Member expressions ====================

    private Evaluator compileCall(CallExpression call) {
        Evaluator callee = compile(call.callee());
        List<Evaluator> arguments = compileAll(call.arguments());
        return (locals, scope, index) -> {
            List<Value> values = new ArrayList<>(arguments.size());
            for (Evaluator argument : arguments) {
                values.add(argument.evaluate(locals, scope, IndexCursor.empty()));
            }
            Value target = callee.evaluate(locals, scope, IndexCursor.empty());
            if (!(target instanceof Macro macro)) {
                throw new TypeMismatchException("Cannot call " + Values.describe(target) + "; only macros are callable");
            }
            return macro.invoke(values, scope);
        };
    }

    /**
     * Member access yields: the member becomes the only cursor key and the
     * selected branch comes back unevaluated, ready for further chaining.
     */
    private Evaluator compileProperty(PropertyExpression property) {
        Evaluator base = property.expression() instanceof AttributeExpression attribute
                ? compileAttributeReference(attribute)
                : compile(property.expression());
        Evaluator member = memberKey(property.property(), property.computed());
        return (locals, scope, index) -> {
            Value target = base.evaluate(locals, scope, IndexCursor.empty());
            IndexCursor cursor = IndexCursor.of(TextResolver.toKey(member, locals, scope));
            if (target instanceof Entity entity) {
                return entity.yield(scope, cursor);
            }
            if (target instanceof Value.AttributeRef ref) {
                return ref.yield(scope, cursor);
            }
            if (target instanceof Value.Thunk thunk) {
                return thunk.invoke(scope, cursor);
            }
            throw new TypeMismatchException("Cannot access a member of " + Values.describe(target));
        };
    }

    /**
     * Attribute access starts a fresh resolution rooted at the owning entity.
     */
    private Evaluator compileAttribute(AttributeExpression attribute) {
        Evaluator base = compile(attribute.expression());
        Evaluator name = memberKey(attribute.attribute(), attribute.computed());
        return (locals, scope, index) -> {
            Entity owner = requireEntity(base.evaluate(locals, scope, IndexCursor.empty()));
            String attributeName = TextResolver.toText(TextResolver.toKey(name, locals, scope), scope);
            return Value.str(owner.resolveAttribute(attributeName, scope));
        };
    }

    private Evaluator compileAttributeReference(AttributeExpression attribute) {
        Evaluator base = compile(attribute.expression());
        Evaluator name = memberKey(attribute.attribute(), attribute.computed());
        return (locals, scope, index) -> {
            Entity owner = requireEntity(base.evaluate(locals, scope, IndexCursor.empty()));
            String attributeName = TextResolver.toText(TextResolver.toKey(name, locals, scope), scope);
            return new Value.AttributeRef(owner, owner.requireAttribute(attributeName));
        };
    }

    private Evaluator memberKey(Node member, boolean computed) {
        if (computed) {
            return compile(member);
        }
        return Evaluator.constant(Value.str(((Identifier) member).name()));
    }

    private static Entity requireEntity(Value value) {
        if (value instanceof Entity entity) {
            return entity;
        }
        throw new TypeMismatchException("Attributes can only be read from entities, not from " + Values.describe(value));
    }
}
