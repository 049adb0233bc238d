package org.l20n.engine.compiler;

/**
 * Thrown when a resolution re-enters an interpolated string it is still
 * evaluating, or nests deeper than the configured limit.
 */
public class CyclicReferenceException extends L20nResolutionException {

    public CyclicReferenceException(String message) {
        super(message);
    }
}
