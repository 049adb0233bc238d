package org.l20n.engine.compiler;

import java.util.Map;

/**
 * Resolved entity as handed to external consumers.
 *
 * @param value      The resolved value, or null for attribute-only entities
 * @param attributes Resolved attributes by id, in source order
 */
public record EntitySnapshot(String value, Map<String, String> attributes) {
}
