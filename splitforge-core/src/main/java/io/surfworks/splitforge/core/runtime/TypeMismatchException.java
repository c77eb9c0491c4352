package io.surfworks.splitforge.core.runtime;

/**
 * The descriptor's element type does not match the declared type.
 */
public class TypeMismatchException extends ArgumentMismatchException {

    public TypeMismatchException(String argName, String field, Object expected, Object actual) {
        super("Type", argName, field, expected, actual);
    }
}
