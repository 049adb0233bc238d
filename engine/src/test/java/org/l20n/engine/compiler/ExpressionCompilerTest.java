package org.l20n.engine.compiler;

import org.l20n.dsl.ArrayLiteral;
import org.l20n.dsl.BinaryExpression;
import org.l20n.dsl.Comment;
import org.l20n.dsl.ComplexString;
import org.l20n.dsl.ConditionalExpression;
import org.l20n.dsl.EntityDefinition;
import org.l20n.dsl.Global;
import org.l20n.dsl.HashLiteral;
import org.l20n.dsl.Identifier;
import org.l20n.dsl.KeyValuePair;
import org.l20n.dsl.L20nCompileException;
import org.l20n.dsl.LogicalExpression;
import org.l20n.dsl.Node;
import org.l20n.dsl.NumberLiteral;
import org.l20n.dsl.StringLiteral;
import org.l20n.dsl.ThisExpression;
import org.l20n.dsl.UnaryExpression;
import org.l20n.dsl.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionCompiler - compiles syntax nodes into evaluators.
 */
@DisplayName("ExpressionCompiler Tests")
class ExpressionCompilerTest {

    private ExpressionCompiler compiler;
    private ResolutionScope scope;

    @BeforeEach
    void setUp() {
        compiler = new ExpressionCompiler();
        Context context = new Context(
                Map.of("brandName", Value.str("Firefox")),
                Map.of("hour", Value.num(10)));
        scope = new ResolutionScope(context, CallerData.of(Map.of("n", 5, "name", "World")), CompilerOptions.defaults());
    }

    private Value eval(Node node) {
        return eval(node, IndexCursor.empty());
    }

    private Value eval(Node node, IndexCursor index) {
        return compiler.compile(node).evaluate(Locals.forEntity(null, true), scope, index);
    }

    private static StringLiteral str(String value) {
        return new StringLiteral(value);
    }

    private static NumberLiteral num(double value) {
        return new NumberLiteral(value);
    }

    // ==================== Primary expressions ====================

    @Nested
    @DisplayName("Primary expressions")
    class PrimaryTests {

        @Test
        @DisplayName("Literals evaluate to their content")
        void testLiterals() {
            assertEquals(Value.num(3), eval(num(3)));
            assertEquals(Value.str("text"), eval(str("text")));
        }

        @Test
        @DisplayName("Identifier looks up context entries at evaluation time")
        void testIdentifier() {
            assertEquals(Value.str("Firefox"), eval(new Identifier("brandName")));
            assertSame(Value.undefined(), eval(new Identifier("missing")));
        }

        @Test
        @DisplayName("Global reads the context globals")
        void testGlobal() {
            assertEquals(Value.num(10), eval(new Global("hour")));
            assertSame(Value.undefined(), eval(new Global("os")));
        }

        @Test
        @DisplayName("Variable falls back to caller data")
        void testVariableFromCallerData() {
            assertEquals(Value.num(5), eval(new Variable("n")));
            assertSame(Value.undefined(), eval(new Variable("missing")));
        }

        @Test
        @DisplayName("Local binding shadows caller data")
        void testVariableShadowing() {
            Evaluator variable = compiler.compile(new Variable("n"));
            Value value = variable.evaluate(Locals.forMacro(Map.of("n", Value.num(1))), scope, IndexCursor.empty());
            assertEquals(Value.num(1), value);
        }

        @Test
        @DisplayName("Local bound to undefined does not shadow caller data")
        void testUndefinedLocalFallsThrough() {
            Evaluator variable = compiler.compile(new Variable("n"));
            Value value = variable.evaluate(Locals.forMacro(Map.of("n", Value.undefined())), scope, IndexCursor.empty());
            assertEquals(Value.num(5), value);
        }

        @Test
        @DisplayName("This without an active entity is undefined")
        void testThisOutsideEntity() {
            assertSame(Value.undefined(), eval(new ThisExpression()));
        }
    }

    // ==================== Operators ====================

    @Nested
    @DisplayName("Operators")
    class OperatorTests {

        @Test
        @DisplayName("Unary operators")
        void testUnary() {
            assertEquals(Value.num(-5), eval(new UnaryExpression("-", num(5))));
            assertEquals(Value.num(3), eval(new UnaryExpression("+", str("3"))));
            assertEquals(Value.bool(true), eval(new UnaryExpression("!", str(""))));
            assertEquals(Value.bool(false), eval(new UnaryExpression("!", num(1))));
        }

        @Test
        @DisplayName("Arithmetic on numbers")
        void testArithmetic() {
            assertEquals(Value.num(1), eval(new BinaryExpression(num(7), "%", num(3))));
            assertEquals(Value.num(12), eval(new BinaryExpression(num(3), "*", num(4))));
            assertEquals(Value.num(2.5), eval(new BinaryExpression(num(5), "/", num(2))));
            assertEquals(Value.num(-1), eval(new BinaryExpression(num(2), "-", num(3))));
            assertEquals(Value.num(5), eval(new BinaryExpression(num(2), "+", num(3))));
        }

        @Test
        @DisplayName("Plus concatenates when a string is involved")
        void testConcatenation() {
            assertEquals(Value.str("a1"), eval(new BinaryExpression(str("a"), "+", num(1))));
            assertEquals(Value.str("ab"), eval(new BinaryExpression(str("a"), "+", str("b"))));
        }

        @Test
        @DisplayName("Comparisons")
        void testComparison() {
            assertEquals(Value.bool(true), eval(new BinaryExpression(num(2), "<", num(3))));
            assertEquals(Value.bool(true), eval(new BinaryExpression(num(3), "<=", num(3))));
            assertEquals(Value.bool(false), eval(new BinaryExpression(num(2), ">", num(3))));
            assertEquals(Value.bool(true), eval(new BinaryExpression(str("b"), ">=", str("a"))));
            assertEquals(Value.bool(true), eval(new BinaryExpression(new Variable("n"), "==", num(5))));
            assertEquals(Value.bool(true), eval(new BinaryExpression(str("1"), "==", num(1))));
            assertEquals(Value.bool(true), eval(new BinaryExpression(str("a"), "!=", num(1))));
        }

        @Test
        @DisplayName("Arithmetic on a string is a type mismatch")
        void testArithmeticTypeMismatch() {
            assertThrows(TypeMismatchException.class, () -> eval(new BinaryExpression(num(1), "-", str("a"))));
            assertThrows(TypeMismatchException.class, () -> eval(new UnaryExpression("-", str("a"))));
            assertThrows(TypeMismatchException.class, () -> eval(new BinaryExpression(num(1), "<", str("a"))));
        }

        @Test
        @DisplayName("Unknown operators fail at compile time")
        void testUnknownOperator() {
            assertThrows(L20nCompileException.class, () -> compiler.compile(new BinaryExpression(num(1), "**", num(2))));
            assertThrows(L20nCompileException.class, () -> compiler.compile(new UnaryExpression("~", num(2))));
            assertThrows(L20nCompileException.class, () -> compiler.compile(new LogicalExpression(num(1), "^^", num(2))));
        }

        @Test
        @DisplayName("Logical operators return the deciding operand")
        void testLogical() {
            assertEquals(Value.str("x"), eval(new LogicalExpression(num(0), "||", str("x"))));
            assertEquals(Value.num(1), eval(new LogicalExpression(num(1), "||", str("x"))));
            assertEquals(Value.num(0), eval(new LogicalExpression(num(1), "&&", num(0))));
            assertEquals(Value.str(""), eval(new LogicalExpression(str(""), "&&", num(2))));
        }

        @Test
        @DisplayName("Logical expression without operator is its operand")
        void testLogicalWithoutOperator() {
            assertEquals(Value.num(4), eval(LogicalExpression.of(num(4))));
        }

        @Test
        @DisplayName("Conditional evaluates only the chosen branch")
        void testConditionalShortCircuit() {
            Node failing = new UnaryExpression("-", str("boom"));
            assertEquals(Value.str("yes"), eval(new ConditionalExpression(num(1), str("yes"), failing)));
            assertEquals(Value.str("no"), eval(new ConditionalExpression(str(""), failing, str("no"))));
        }
    }

    // ==================== Selectors ====================

    @Nested
    @DisplayName("Selector literals")
    class SelectorTests {

        @Test
        @DisplayName("Hash falls back to the first declared branch")
        void testHashFallbackToFirst() {
            Node hash = HashLiteral.of(KeyValuePair.of("one", str("A")));
            assertEquals(Value.str("A"), eval(hash, IndexCursor.of("other")));
        }

        @Test
        @DisplayName("Hash falls back to the branch marked default")
        void testHashMarkedDefault() {
            Node hash = HashLiteral.of(
                    KeyValuePair.of("one", str("A")),
                    KeyValuePair.defaultOf("other", str("B")));
            assertEquals(Value.str("B"), eval(hash, IndexCursor.of("few")));
            assertEquals(Value.str("A"), eval(hash, IndexCursor.of("one")));
            assertEquals(Value.str("B"), eval(hash, IndexCursor.empty()));
        }

        @Test
        @DisplayName("Array selects by position")
        void testArrayExactMatch() {
            Node array = ArrayLiteral.of(str("zero"), str("one"));
            assertEquals(Value.str("one"), eval(array, IndexCursor.of(1)));
            assertEquals(Value.str("one"), eval(array, IndexCursor.of("1")));
        }

        @Test
        @DisplayName("Array falls back to default for falsy or missing keys")
        void testArrayFallback() {
            Node array = new ArrayLiteral(List.of(str("zero"), str("one"), str("two")), 2);
            assertEquals(Value.str("two"), eval(array, IndexCursor.of(0)));
            assertEquals(Value.str("two"), eval(array, IndexCursor.of(7)));
            assertEquals(Value.str("two"), eval(array, IndexCursor.of("x")));
            assertEquals(Value.str("one"), eval(array, IndexCursor.of(1)));
        }

        @Test
        @DisplayName("Array only selects by canonical integer strings")
        void testArrayNonCanonicalKeys() {
            Node array = new ArrayLiteral(List.of(str("zero"), str("one"), str("two")), 2);
            assertEquals(Value.str("one"), eval(array, IndexCursor.of("1")));
            assertEquals(Value.str("zero"), eval(array, IndexCursor.of("0")));
            assertEquals(Value.str("two"), eval(array, IndexCursor.of(" 1 ")));
            assertEquals(Value.str("two"), eval(array, IndexCursor.of("1.0")));
            assertEquals(Value.str("two"), eval(array, IndexCursor.of("1e0")));
            assertEquals(Value.str("two"), eval(array, IndexCursor.of("01")));
        }

        @Test
        @DisplayName("Nested selectors consume one key each")
        void testNestedSelectors() {
            Node nested = ArrayLiteral.of(
                    HashLiteral.of(KeyValuePair.of("a", str("0a")), KeyValuePair.of("b", str("0b"))),
                    HashLiteral.of(KeyValuePair.of("a", str("1a")), KeyValuePair.of("b", str("1b"))));
            assertEquals(Value.str("1b"), eval(nested, IndexCursor.of(1, "b")));
            assertEquals(Value.str("0a"), eval(nested, IndexCursor.of(0)));
        }

        @Test
        @DisplayName("Evaluator keys are evaluated when popped")
        void testEvaluatorKey() {
            Node hash = HashLiteral.of(KeyValuePair.of("few", str("F")), KeyValuePair.of("many", str("M")));
            Evaluator key = compiler.compile(new ConditionalExpression(
                    new BinaryExpression(new Variable("n"), ">", num(4)), str("many"), str("few")));
            assertEquals(Value.str("M"), eval(hash, IndexCursor.ofEvaluators(List.of(key))));
        }

        @Test
        @DisplayName("Unselected branches are never evaluated")
        void testUnselectedBranchesNotEvaluated() {
            Node hash = HashLiteral.of(
                    KeyValuePair.of("a", str("ok")),
                    KeyValuePair.of("b", new UnaryExpression("-", str("boom"))));
            assertEquals(Value.str("ok"), eval(hash, IndexCursor.of("a")));
        }

        @Test
        @DisplayName("Yield mode returns the selected branch as a thunk")
        void testYieldMode() {
            Evaluator hash = compiler.compile(HashLiteral.of(
                    KeyValuePair.of("a", str("A")),
                    KeyValuePair.of("b", str("B"))));
            Value value = hash.evaluate(Locals.forEntity(null, false), scope, IndexCursor.of("b"));

            Value.Thunk thunk = assertInstanceOf(Value.Thunk.class, value);
            assertEquals(Value.str("B"), thunk.invoke(scope, IndexCursor.empty()));
        }

        @Test
        @DisplayName("Empty selector literals are rejected")
        void testEmptySelector() {
            assertThrows(L20nCompileException.class, () -> compiler.compile(new ArrayLiteral(List.of(), 0)));
            assertThrows(L20nCompileException.class, () -> compiler.compile(new HashLiteral(List.of())));
        }
    }

    // ==================== Interpolation ====================

    @Nested
    @DisplayName("Interpolated strings")
    class ComplexStringTests {

        @Test
        @DisplayName("Parts are concatenated in order")
        void testConcatenation() {
            Node complex = ComplexString.of(str("Hello, "), new Variable("name"), str("!"));
            assertEquals(Value.str("Hello, World!"), eval(complex));
        }

        @Test
        @DisplayName("Numbers interpolate without a fraction")
        void testNumberPart() {
            Node complex = ComplexString.of(str("You have "), new Variable("n"), str(" and "), num(1.5));
            assertEquals(Value.str("You have 5 and 1.5"), eval(complex));
        }

        @Test
        @DisplayName("Large whole numbers interpolate in plain notation")
        void testLargeNumberPart() {
            assertEquals(Value.str("1000000000000000"), eval(ComplexString.of(num(1e15))));
            assertEquals(Value.str("10000000000000000 items"), eval(ComplexString.of(num(1e16), str(" items"))));
            assertEquals(Value.str("-20000000000000000"), eval(ComplexString.of(num(-2e16))));
            assertEquals(Value.str("0"), eval(ComplexString.of(num(0))));
        }

        @Test
        @DisplayName("Selector parts are driven to text")
        void testSelectorPart() {
            Node complex = ComplexString.of(str("["), HashLiteral.of(KeyValuePair.of("a", str("A"))), str("]"));
            assertEquals(Value.str("[A]"), eval(complex));
        }

        @Test
        @DisplayName("Undefined part fails by default")
        void testUndefinedPartFails() {
            Node complex = ComplexString.of(str("Hi "), new Variable("missing"));
            assertThrows(TypeMismatchException.class, () -> eval(complex));
        }

        @Test
        @DisplayName("Undefined part is empty under the EMPTY policy")
        void testUndefinedPartEmpty() {
            ResolutionScope lenient = new ResolutionScope(Context.empty(), CallerData.empty(),
                    CompilerOptions.defaults().withUndefinedInText(CompilerOptions.UndefinedPolicy.EMPTY));
            Evaluator complex = compiler.compile(ComplexString.of(str("Hi "), new Variable("missing")));
            assertEquals(Value.str("Hi "), complex.evaluate(Locals.forEntity(null, true), lenient, IndexCursor.empty()));
        }
    }

    // ==================== Malformed nodes ====================

    @Test
    @DisplayName("Definitions and comments are not expressions")
    void testMalformedNode() {
        assertThrows(L20nCompileException.class, () -> compiler.compile(EntityDefinition.of("a", str("x"))));
        assertThrows(L20nCompileException.class, () -> compiler.compile(new Comment("note")));
    }
}
