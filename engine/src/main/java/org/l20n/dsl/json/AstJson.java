package org.l20n.dsl.json;

import org.l20n.dsl.L20nCompileException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON parser for the syntax trees emitted by the L20n parser.
 *
 * Produces Map (objects, key order kept), List (arrays), String, Long/Double,
 * Boolean and null.
 */
public final class AstJson {

    private AstJson() {
    }

    /**
     * Parse a JSON document.
     *
     * @throws L20nCompileException if the text is not well-formed JSON
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new L20nCompileException("Empty syntax tree document");
        }
        Parser parser = new Parser(json);
        Object value = parser.parseValue();
        parser.expectEnd();
        return value;
    }

    // ========== PARSER IMPLEMENTATION ==========

    private static class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json;
        }

        Object parseValue() {
            skipWhitespace();
            if (pos >= json.length()) {
                throw error("Unexpected end of input");
            }

            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't', 'f' -> parseBoolean();
                case 'n' -> parseNull();
                default -> parseNumber();
            };
        }

        void expectEnd() {
            skipWhitespace();
            if (pos < json.length()) {
                throw error("Unexpected trailing content");
            }
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // skip '{'
            skipWhitespace();

            if (peek() == '}') {
                pos++;
                return map;
            }

            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw error("Expected object key");
                }
                String key = parseString();
                skipWhitespace();
                expect(':');
                map.put(key, parseValue());
                skipWhitespace();

                char c = peek();
                pos++;
                if (c == '}') {
                    return map;
                }
                if (c != ',') {
                    throw error("Expected ',' or '}'");
                }
            }
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++; // skip '['
            skipWhitespace();

            if (peek() == ']') {
                pos++;
                return list;
            }

            while (true) {
                list.add(parseValue());
                skipWhitespace();

                char c = peek();
                pos++;
                if (c == ']') {
                    return list;
                }
                if (c != ',') {
                    throw error("Expected ',' or ']'");
                }
            }
        }

        private String parseString() {
            pos++; // skip opening quote
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                } else if (c == '\\' && pos < json.length()) {
                    char escaped = json.charAt(pos++);
                    switch (escaped) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            if (pos + 4 > json.length()) {
                                throw error("Truncated unicode escape");
                            }
                            try {
                                sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                            } catch (NumberFormatException e) {
                                throw error("Invalid unicode escape");
                            }
                            pos += 4;
                        }
                        default -> sb.append(escaped);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw error("Unterminated string");
        }

        private Number parseNumber() {
            int start = pos;
            if (peek() == '-')
                pos++;
            while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                pos++;

            boolean isFloat = false;
            if (peek() == '.') {
                isFloat = true;
                pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }
            if (peek() == 'e' || peek() == 'E') {
                isFloat = true;
                pos++;
                if (peek() == '+' || peek() == '-')
                    pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }

            String num = json.substring(start, pos);
            try {
                return isFloat ? Double.parseDouble(num) : Long.parseLong(num);
            } catch (NumberFormatException e) {
                pos = start;
                throw error("Invalid number '" + num + "'");
            }
        }

        private Boolean parseBoolean() {
            if (json.startsWith("true", pos)) {
                pos += 4;
                return true;
            } else if (json.startsWith("false", pos)) {
                pos += 5;
                return false;
            }
            throw error("Invalid boolean");
        }

        private Object parseNull() {
            if (json.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            throw error("Invalid null");
        }

        private char peek() {
            return pos < json.length() ? json.charAt(pos) : '\0';
        }

        private void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            if (peek() == expected) {
                pos++;
            } else {
                throw error("Expected '" + expected + "'");
            }
        }

        private L20nCompileException error(String message) {
            return new L20nCompileException(message + " at position " + pos);
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Get a string value from a map.
     */
    static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }

    static boolean getBoolean(Map<String, Object> map, String key) {
        return Boolean.TRUE.equals(map.get(key));
    }

    /**
     * Get a list from a map; a missing key reads as an empty list.
     */
    @SuppressWarnings("unchecked")
    static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof List ? (List<Object>) value : List.of();
    }
}
