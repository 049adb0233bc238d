package org.l20n.dsl.json;

import org.l20n.dsl.ArrayLiteral;
import org.l20n.dsl.AttributeDefinition;
import org.l20n.dsl.AttributeExpression;
import org.l20n.dsl.BinaryExpression;
import org.l20n.dsl.CallExpression;
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
import org.l20n.dsl.MacroDefinition;
import org.l20n.dsl.Node;
import org.l20n.dsl.NumberLiteral;
import org.l20n.dsl.PropertyExpression;
import org.l20n.dsl.StringLiteral;
import org.l20n.dsl.ThisExpression;
import org.l20n.dsl.UnaryExpression;
import org.l20n.dsl.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON syntax tree produced by the L20n parser into {@link Node} records.
 *
 * The document is either an array of top-level nodes or an object with a
 * {@code body} array. Every node is an object tagged by {@code type}:
 * - entity: id, value, index, attrs, local
 * - macro: id, args (variables), expression
 * - comment: content
 * - expressions: identifier, this, variable, global, number, string, array,
 *   hash, complexString, keyValuePair, unaryExpression, binaryExpression,
 *   logicalExpression, conditionalExpression, callExpression,
 *   propertyExpression, attributeExpression
 *
 * Unknown top-level types are skipped; unknown nested types are malformed.
 */
public final class AstJsonReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(AstJsonReader.class);

    private AstJsonReader() {
        // Static utility class
    }

    /**
     * Reads a resource's top-level definitions.
     *
     * @param json The parser output
     * @return Definitions and comments in source order
     * @throws L20nCompileException if the document or one of its nodes is malformed
     */
    @SuppressWarnings("unchecked")
    public static List<Node> read(String json) {
        Object document = AstJson.parse(json);
        List<Object> body;
        if (document instanceof List) {
            body = (List<Object>) document;
        } else if (document instanceof Map) {
            body = AstJson.getList((Map<String, Object>) document, "body");
        } else {
            throw new L20nCompileException("Syntax tree must be an array or an object with a body");
        }

        List<Node> definitions = new ArrayList<>(body.size());
        for (Object element : body) {
            Map<String, Object> object = asObject(element);
            String type = AstJson.getString(object, "type");
            switch (type == null ? "" : type) {
                case "entity" -> definitions.add(readEntity(object));
                case "macro" -> definitions.add(readMacro(object));
                case "comment" -> definitions.add(new Comment(AstJson.getString(object, "content")));
                default -> LOGGER.debug("Skipping top-level node of type '{}'", type);
            }
        }
        return definitions;
    }

    /**
     * Reads a single expression node.
     */
    public static Node readExpression(String json) {
        return readNode(AstJson.parse(json));
    }

    // ==================== Definitions ====================

    private static EntityDefinition readEntity(Map<String, Object> object) {
        String id = readId(object);
        Object value = object.get("value");
        List<Node> index = readNodes(AstJson.getList(object, "index"));
        List<AttributeDefinition> attrs = new ArrayList<>();
        for (Object attr : AstJson.getList(object, "attrs")) {
            Map<String, Object> attrObject = asObject(attr);
            attrs.add(new AttributeDefinition(readId(attrObject), readNode(attrObject.get("value")),
                    AstJson.getBoolean(attrObject, "local")));
        }
        return new EntityDefinition(id, value != null ? readNode(value) : null, index, attrs,
                AstJson.getBoolean(object, "local"));
    }

    private static MacroDefinition readMacro(Map<String, Object> object) {
        List<String> args = new ArrayList<>();
        for (Object arg : AstJson.getList(object, "args")) {
            args.add(readName(asObject(arg)));
        }
        return new MacroDefinition(readId(object), args, readNode(object.get("expression")));
    }

    // ==================== Expressions ====================

    private static Node readNode(Object json) {
        Map<String, Object> object = asObject(json);
        String type = AstJson.getString(object, "type");
        if (type == null) {
            throw new L20nCompileException("Syntax node without type: " + object);
        }
        try {
            return readTyped(type, object);
        } catch (IllegalArgumentException e) {
            throw new L20nCompileException("Malformed " + type + " node: " + e.getMessage(), e);
        }
    }

    private static Node readTyped(String type, Map<String, Object> object) {
        return switch (type) {
            case "identifier" -> new Identifier(readName(object));
            case "this" -> new ThisExpression();
            case "variable" -> new Variable(readName(object));
            case "global" -> new Global(readName(object));
            case "number" -> new NumberLiteral(readNumber(object.get("content")));
            case "string" -> new StringLiteral(requireString(object, "content"));
            case "array" -> readArray(object);
            case "hash" -> readHash(object);
            case "complexString" -> new ComplexString(readNodes(AstJson.getList(object, "content")));
            case "keyValuePair" -> readPair(object);
            case "unaryExpression" -> new UnaryExpression(requireString(object, "operator"),
                    readNode(object.get("operand")));
            case "binaryExpression" -> new BinaryExpression(readNode(object.get("left")),
                    requireString(object, "operator"), readNode(object.get("right")));
            case "logicalExpression" -> readLogical(object);
            case "conditionalExpression" -> new ConditionalExpression(readNode(object.get("test")),
                    readNode(object.get("consequent")), readNode(object.get("alternate")));
            case "callExpression" -> new CallExpression(readNode(object.get("callee")),
                    readNodes(AstJson.getList(object, "arguments")));
            case "propertyExpression" -> new PropertyExpression(readNode(object.get("expression")),
                    readNode(object.get("property")), AstJson.getBoolean(object, "computed"));
            case "attributeExpression" -> new AttributeExpression(readNode(object.get("expression")),
                    readNode(object.get("attribute")), AstJson.getBoolean(object, "computed"));
            default -> throw new L20nCompileException("Unknown syntax node type: " + type);
        };
    }

    private static List<Node> readNodes(List<Object> elements) {
        List<Node> nodes = new ArrayList<>(elements.size());
        for (Object element : elements) {
            nodes.add(readNode(element));
        }
        return nodes;
    }

    /**
     * The last element flagged as default wins, as in the hash literal.
     */
    private static ArrayLiteral readArray(Map<String, Object> object) {
        List<Object> elements = AstJson.getList(object, "content");
        int defaultIndex = 0;
        for (int i = 0; i < elements.size(); i++) {
            if (AstJson.getBoolean(asObject(elements.get(i)), "default")) {
                defaultIndex = i;
            }
        }
        return new ArrayLiteral(readNodes(elements), defaultIndex);
    }

    private static HashLiteral readHash(Map<String, Object> object) {
        List<KeyValuePair> pairs = new ArrayList<>();
        for (Object element : AstJson.getList(object, "content")) {
            Node pair = readNode(element);
            if (!(pair instanceof KeyValuePair keyValuePair)) {
                throw new L20nCompileException("Hash members must be key-value pairs: " + pair);
            }
            pairs.add(keyValuePair);
        }
        return new HashLiteral(pairs);
    }

    private static KeyValuePair readPair(Map<String, Object> object) {
        return new KeyValuePair(readId(object), readNode(object.get("value")), AstJson.getBoolean(object, "default"));
    }

    private static LogicalExpression readLogical(Map<String, Object> object) {
        String operator = AstJson.getString(object, "operator");
        Node left = readNode(object.get("left"));
        return operator == null ? LogicalExpression.of(left)
                : new LogicalExpression(left, operator, readNode(object.get("right")));
    }

    // ==================== Scalars ====================

    /**
     * Ids are plain strings or identifier nodes.
     */
    private static String readId(Map<String, Object> object) {
        Object id = object.get("id");
        if (id instanceof String s) {
            return s;
        }
        if (id instanceof Map) {
            return readName(asObject(id));
        }
        throw new L20nCompileException("Missing id in " + AstJson.getString(object, "type") + " node");
    }

    private static String readName(Map<String, Object> object) {
        return requireString(object, "name");
    }

    private static double readNumber(Object content) {
        if (content instanceof Number n) {
            return n.doubleValue();
        }
        if (content instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new L20nCompileException("Invalid number literal: " + s, e);
            }
        }
        throw new L20nCompileException("Number literal without content");
    }

    private static String requireString(Map<String, Object> object, String key) {
        String value = AstJson.getString(object, key);
        if (value == null) {
            throw new L20nCompileException("Missing '" + key + "' in " + AstJson.getString(object, "type") + " node");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object json) {
        if (json instanceof Map) {
            return (Map<String, Object>) json;
        }
        throw new L20nCompileException("Expected a syntax node object but got " + json);
    }
}
