package org.l20n.engine.compiler;

/**
 * Base class of the errors raised while resolving a compiled entity or macro.
 * A resolution that throws produces no partial result.
 */
public class L20nResolutionException extends RuntimeException {

    public L20nResolutionException(String message) {
        super(message);
    }

    public L20nResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
