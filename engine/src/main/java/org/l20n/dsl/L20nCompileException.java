package org.l20n.dsl;

/**
 * Exception thrown when a syntax tree cannot be compiled: an unknown node kind
 * or operator, a definition where an expression is expected, or a rejected
 * duplicate id.
 */
public class L20nCompileException extends RuntimeException {

    public L20nCompileException(String message) {
        super(message);
    }

    public L20nCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
