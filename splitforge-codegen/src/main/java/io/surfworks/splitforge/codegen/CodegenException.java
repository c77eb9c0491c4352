package io.surfworks.splitforge.codegen;

/**
 * Exception thrown when generated sources cannot be written.
 */
public class CodegenException extends Exception {

    public CodegenException(String message) {
        super(message);
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
