package org.l20n.dsl;

/**
 * The entity currently being resolved: ~
 */
public record ThisExpression() implements Node {
}
