package io.surfworks.splitforge.core.dtype;

/**
 * Thrown when a custom type name has no registry binding.
 */
public class UnknownTypeNameException extends DatatypeRegistryException {

    private final String typeName;

    public UnknownTypeNameException(String typeName) {
        super("No custom type registered with name '" + typeName + "'");
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
