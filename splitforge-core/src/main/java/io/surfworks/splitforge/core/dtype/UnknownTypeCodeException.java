package io.surfworks.splitforge.core.dtype;

/**
 * Thrown when a custom type code has no registry binding.
 */
public class UnknownTypeCodeException extends DatatypeRegistryException {

    private final int code;

    public UnknownTypeCodeException(int code) {
        super("No custom type registered for code " + code);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
