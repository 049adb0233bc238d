package org.l20n.dsl;

/**
 * Number literal: 0, 42, 3.5
 */
public record NumberLiteral(double content) implements Node {
}
