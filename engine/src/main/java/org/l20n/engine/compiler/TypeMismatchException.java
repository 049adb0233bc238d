package org.l20n.engine.compiler;

/**
 * Thrown when a value is used where its kind does not fit: arithmetic on a
 * string, calling something that is not a macro, member access on a plain
 * value, or interpolating undefined.
 */
public class TypeMismatchException extends L20nResolutionException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
