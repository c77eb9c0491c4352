package io.surfworks.splitforge.core.dtype;

/**
 * Base class for datatype registry misuse. Always fatal to the compilation
 * that triggered it.
 */
public class DatatypeRegistryException extends RuntimeException {

    public DatatypeRegistryException(String message) {
        super(message);
    }
}
