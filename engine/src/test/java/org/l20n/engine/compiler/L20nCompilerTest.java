package org.l20n.engine.compiler;

import org.l20n.dsl.AttributeDefinition;
import org.l20n.dsl.BinaryExpression;
import org.l20n.dsl.Comment;
import org.l20n.dsl.ComplexString;
import org.l20n.dsl.EntityDefinition;
import org.l20n.dsl.Identifier;
import org.l20n.dsl.L20nCompileException;
import org.l20n.dsl.MacroDefinition;
import org.l20n.dsl.Node;
import org.l20n.dsl.NumberLiteral;
import org.l20n.dsl.StringLiteral;
import org.l20n.dsl.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the L20nCompiler entry point and CompilerOptions.
 */
@DisplayName("L20nCompiler Tests")
class L20nCompilerTest {

    private static final List<Node> RESOURCE = List.of(
            new Comment("Sample resource"),
            EntityDefinition.of("title", new StringLiteral("Settings")),
            new EntityDefinition("_brand", new StringLiteral("Firefox"), List.of(), List.of(), true),
            new MacroDefinition("double", List.of("n"), new BinaryExpression(new Variable("n"), "*", new NumberLiteral(2))),
            new EntityDefinition("greeting", ComplexString.of(new StringLiteral("Hi "), new Variable("name")),
                    List.of(), List.of(AttributeDefinition.of("tooltip", new StringLiteral("Greeting"))), false));

    @Nested
    @DisplayName("Compile")
    class CompileTests {

        @Test
        @DisplayName("Entities and macros are keyed by id in source order")
        void testSourceOrder() {
            CompiledResource resource = new L20nCompiler().compile(RESOURCE);

            assertEquals(List.of("title", "_brand", "double", "greeting"), new ArrayList<>(resource.ids()));
            assertEquals(4, resource.size());
            assertInstanceOf(Entity.class, resource.get("title"));
            assertInstanceOf(Macro.class, resource.get("double"));
            assertNull(resource.get("missing"));
        }

        @Test
        @DisplayName("Local entities are excluded from public ids")
        void testPublicIds() {
            CompiledResource resource = new L20nCompiler().compile(RESOURCE);

            assertEquals(List.of("title", "greeting"), resource.publicIds());
            assertTrue(resource.findEntity("_brand").orElseThrow().isLocal());
        }

        @Test
        @DisplayName("Typed lookups")
        void testFindEntityAndMacro() {
            CompiledResource resource = new L20nCompiler().compile(RESOURCE);

            assertTrue(resource.findEntity("title").isPresent());
            assertTrue(resource.findEntity("double").isEmpty());
            assertTrue(resource.findMacro("double").isPresent());
            assertTrue(resource.findMacro("title").isEmpty());
            assertEquals(1, resource.findEntity("greeting").orElseThrow().attributes().size());
        }

        @Test
        @DisplayName("Compiling twice yields independent, identical resources")
        void testDeterminism() {
            L20nCompiler compiler = new L20nCompiler();
            CompiledResource first = compiler.compile(RESOURCE);
            CompiledResource second = compiler.compile(RESOURCE);
            CallerData data = CallerData.of(Map.of("name", "Ann"));

            Entity a = first.findEntity("greeting").orElseThrow();
            Entity b = second.findEntity("greeting").orElseThrow();

            assertNotSame(a, b);
            assertEquals(a.getEntity(first.context(), data), b.getEntity(second.context(), data));
        }

        @Test
        @DisplayName("Duplicate ids: last definition wins, first position kept")
        void testDuplicateLastWins() {
            CompiledResource resource = new L20nCompiler().compile(List.of(
                    EntityDefinition.of("a", new StringLiteral("first")),
                    EntityDefinition.of("b", new StringLiteral("b")),
                    EntityDefinition.of("a", new StringLiteral("second"))));

            assertEquals(List.of("a", "b"), new ArrayList<>(resource.ids()));
            assertEquals("second", resource.findEntity("a").orElseThrow().get(resource.context(), CallerData.empty()));
        }

        @Test
        @DisplayName("Duplicate ids are rejected under REJECT")
        void testDuplicateRejected() {
            L20nCompiler strict = new L20nCompiler(
                    CompilerOptions.defaults().withDuplicateIds(CompilerOptions.DuplicateIdPolicy.REJECT));

            L20nCompileException e = assertThrows(L20nCompileException.class, () -> strict.compile(List.of(
                    EntityDefinition.of("a", new StringLiteral("first")),
                    new MacroDefinition("a", List.of(), new StringLiteral("second")))));
            assertTrue(e.getMessage().contains("'a'"));
        }

        @Test
        @DisplayName("Malformed node names the failing definition")
        void testMalformedDefinition() {
            L20nCompileException e = assertThrows(L20nCompileException.class, () -> new L20nCompiler().compile(List.of(
                    EntityDefinition.of("broken", new Comment("not an expression")))));
            assertTrue(e.getMessage().contains("'broken'"), e.getMessage());
        }

        @Test
        @DisplayName("Non-definition top-level nodes are skipped")
        void testSkipsNonDefinitions() {
            CompiledResource resource = new L20nCompiler().compile(List.of(
                    new Comment("only a comment"),
                    new StringLiteral("stray")));
            assertEquals(0, resource.size());
        }
    }

    @Nested
    @DisplayName("CompilerOptions")
    class OptionsTests {

        @Test
        @DisplayName("Defaults")
        void testDefaults() {
            CompilerOptions options = CompilerOptions.defaults();
            assertEquals(256, options.maxResolutionDepth());
            assertEquals(64, options.maxDriveSteps());
            assertEquals(CompilerOptions.DuplicateIdPolicy.LAST_WINS, options.duplicateIds());
            assertEquals(CompilerOptions.UndefinedPolicy.FAIL, options.undefinedInText());
        }

        @Test
        @DisplayName("Options read from properties")
        void testFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(CompilerOptions.MAX_RESOLUTION_DEPTH, "32");
            properties.setProperty(CompilerOptions.DUPLICATE_IDS, "reject");
            properties.setProperty(CompilerOptions.UNDEFINED_IN_TEXT, "empty");

            CompilerOptions options = CompilerOptions.fromProperties(properties);

            assertEquals(32, options.maxResolutionDepth());
            assertEquals(64, options.maxDriveSteps());
            assertEquals(CompilerOptions.DuplicateIdPolicy.REJECT, options.duplicateIds());
            assertEquals(CompilerOptions.UndefinedPolicy.EMPTY, options.undefinedInText());
        }

        @Test
        @DisplayName("Invalid property values fail")
        void testInvalidProperties() {
            Properties properties = new Properties();
            properties.setProperty(CompilerOptions.MAX_DRIVE_STEPS, "many");
            assertThrows(L20nCompileException.class, () -> CompilerOptions.fromProperties(properties));

            properties.setProperty(CompilerOptions.MAX_DRIVE_STEPS, "0");
            assertThrows(L20nCompileException.class, () -> CompilerOptions.fromProperties(properties));
        }

        @Test
        @DisplayName("Depth limit applies to compiled entities")
        void testDepthLimit() {
            L20nCompiler shallow = new L20nCompiler(CompilerOptions.defaults().withMaxResolutionDepth(2));
            CompiledResource resource = shallow.compile(List.of(
                    EntityDefinition.of("a", new StringLiteral("A")),
                    EntityDefinition.of("b", ComplexString.of(new Identifier("a"))),
                    EntityDefinition.of("c", ComplexString.of(new Identifier("b")))));

            assertEquals("A", resource.findEntity("b").orElseThrow().get(resource.context(), CallerData.empty()));
            assertThrows(CyclicReferenceException.class,
                    () -> resource.findEntity("c").orElseThrow().get(resource.context(), CallerData.empty()));
        }
    }
}
