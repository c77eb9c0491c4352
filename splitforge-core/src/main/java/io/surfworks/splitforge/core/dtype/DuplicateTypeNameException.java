package io.surfworks.splitforge.core.dtype;

/**
 * Thrown when a name or code is already bound to a different registry entry.
 */
public class DuplicateTypeNameException extends DatatypeRegistryException {

    private final String typeName;
    private final int existingCode;

    public DuplicateTypeNameException(String typeName, int existingCode, int requestedCode) {
        super(String.format("Custom type '%s' is already registered with code %d (requested %d)",
            typeName, existingCode, requestedCode));
        this.typeName = typeName;
        this.existingCode = existingCode;
    }

    public DuplicateTypeNameException(int code, String existingName, String requestedName) {
        super(String.format("Type code %d is already bound to '%s' (requested '%s')",
            code, existingName, requestedName));
        this.typeName = requestedName;
        this.existingCode = code;
    }

    public String typeName() {
        return typeName;
    }

    public int existingCode() {
        return existingCode;
    }
}
