package io.surfworks.splitforge.core.runtime;

/**
 * A runtime tensor argument did not satisfy its compile-time declaration.
 *
 * <p>Raised by the generated entry sequence, never by the compiler.
 */
public class ArgumentMismatchException extends RuntimeException {

    private final String argName;
    private final String field;
    private final Object expected;
    private final Object actual;

    public ArgumentMismatchException(String category, String argName, String field,
                                     Object expected, Object actual) {
        super(String.format("%s mismatch for argument %s.%s: expected %s, got %s",
            category, argName, field, expected, actual));
        this.argName = argName;
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public String argName() {
        return argName;
    }

    public String field() {
        return field;
    }

    public Object expected() {
        return expected;
    }

    public Object actual() {
        return actual;
    }
}
