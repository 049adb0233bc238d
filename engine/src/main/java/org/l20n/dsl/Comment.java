package org.l20n.dsl;

/**
 * Top-level comment, carried through from the parser and skipped by the compiler.
 */
public record Comment(String content) implements Node {
}
