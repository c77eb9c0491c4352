package io.surfworks.splitforge.core.runtime;

/**
 * The descriptor's rank, extents, strides or offset do not match the declaration.
 */
public class ShapeMismatchException extends ArgumentMismatchException {

    public ShapeMismatchException(String argName, String field, Object expected, Object actual) {
        super("Shape", argName, field, expected, actual);
    }
}
