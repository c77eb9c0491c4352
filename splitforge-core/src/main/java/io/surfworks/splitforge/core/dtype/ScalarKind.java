package io.surfworks.splitforge.core.dtype;

/**
 * Built-in scalar kinds of the IR type system.
 *
 * <p>Each kind owns a fixed type code below {@link DataType#CUSTOM_BEGIN}.
 * The codes match the runtime tensor descriptor's {@code type_code} field, so
 * they must never be renumbered.
 */
public enum ScalarKind {
    INT(0, "int"),
    UINT(1, "uint"),
    FLOAT(2, "float"),
    HANDLE(3, "handle"),
    BFLOAT(4, "bfloat");

    private final int code;
    private final String shortName;

    ScalarKind(int code, String shortName) {
        this.code = code;
        this.shortName = shortName;
    }

    public int code() {
        return code;
    }

    /**
     * Name prefix used when printing a type, e.g. {@code float} in {@code float32x4}.
     */
    public String shortName() {
        return shortName;
    }

    public boolean isInteger() {
        return this == INT || this == UINT;
    }

    public boolean isFloating() {
        return this == FLOAT || this == BFLOAT;
    }

    /**
     * Look up a built-in kind by type code.
     *
     * @param code the type code
     * @return the kind, or null if the code is not a built-in kind
     */
    public static ScalarKind fromCode(int code) {
        for (ScalarKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return null;
    }
}
