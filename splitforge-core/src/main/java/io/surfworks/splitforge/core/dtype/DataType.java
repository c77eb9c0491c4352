package io.surfworks.splitforge.core.dtype;

/**
 * Scalar or vector element type of an IR value.
 *
 * <p>A type is either {@link BuiltIn} (one of the fixed {@link ScalarKind}s) or
 * {@link Custom} (a code at or above {@link #CUSTOM_BEGIN} whose meaning lives in a
 * {@link DatatypeRegistry}). Call sites branch on the variant instead of comparing
 * raw codes against the threshold.
 *
 * <p>Example:
 * <pre>{@code
 * DataType f32x4 = DataType.float32().withLanes(4);
 * DataType posit = DataType.of(129, 16, 1);   // Custom
 * }</pre>
 */
public sealed interface DataType permits DataType.BuiltIn, DataType.Custom {

    /** First type code available to custom datatypes. */
    int CUSTOM_BEGIN = 129;

    DataType BOOL = new BuiltIn(ScalarKind.UINT, 1, 1);
    DataType INT8 = new BuiltIn(ScalarKind.INT, 8, 1);
    DataType INT32 = new BuiltIn(ScalarKind.INT, 32, 1);
    DataType INT64 = new BuiltIn(ScalarKind.INT, 64, 1);
    DataType UINT8 = new BuiltIn(ScalarKind.UINT, 8, 1);
    DataType UINT16 = new BuiltIn(ScalarKind.UINT, 16, 1);
    DataType UINT64 = new BuiltIn(ScalarKind.UINT, 64, 1);
    DataType FLOAT16 = new BuiltIn(ScalarKind.FLOAT, 16, 1);
    DataType FLOAT32 = new BuiltIn(ScalarKind.FLOAT, 32, 1);
    DataType FLOAT64 = new BuiltIn(ScalarKind.FLOAT, 64, 1);
    DataType BFLOAT16 = new BuiltIn(ScalarKind.BFLOAT, 16, 1);
    DataType HANDLE = new BuiltIn(ScalarKind.HANDLE, 64, 1);

    /** Type code as stored in the runtime descriptor. */
    int code();

    int bits();

    int lanes();

    DataType withLanes(int lanes);

    default boolean isCustom() {
        return this instanceof Custom;
    }

    default boolean isHandle() {
        return this instanceof BuiltIn b && b.kind() == ScalarKind.HANDLE;
    }

    default boolean isScalar() {
        return lanes() == 1;
    }

    default boolean isBool() {
        return this instanceof BuiltIn b && b.kind() == ScalarKind.UINT && b.bits() == 1;
    }

    default boolean isFloating() {
        return this instanceof BuiltIn b && b.kind().isFloating();
    }

    /**
     * Build a type from raw descriptor fields.
     *
     * @throws IllegalArgumentException if the code falls in the reserved range
     *         between the built-in kinds and {@link #CUSTOM_BEGIN}
     */
    static DataType of(int code, int bits, int lanes) {
        if (code >= CUSTOM_BEGIN) {
            return new Custom(code, bits, lanes);
        }
        ScalarKind kind = ScalarKind.fromCode(code);
        if (kind == null) {
            throw new IllegalArgumentException("Reserved type code: " + code);
        }
        return new BuiltIn(kind, bits, lanes);
    }

    static DataType int32() {
        return INT32;
    }

    static DataType float32() {
        return FLOAT32;
    }

    /**
     * One of the fixed scalar kinds.
     */
    record BuiltIn(ScalarKind kind, int bits, int lanes) implements DataType {
        public BuiltIn {
            if (kind == null) {
                throw new IllegalArgumentException("kind must not be null");
            }
            if (bits <= 0 || lanes <= 0) {
                throw new IllegalArgumentException("bits and lanes must be positive: " + bits + "x" + lanes);
            }
        }

        @Override
        public int code() {
            return kind.code();
        }

        @Override
        public DataType withLanes(int lanes) {
            return new BuiltIn(kind, bits, lanes);
        }

        @Override
        public String toString() {
            if (kind == ScalarKind.HANDLE) {
                return "handle";
            }
            if (bits == 1 && kind == ScalarKind.UINT) {
                return lanes == 1 ? "bool" : "boolx" + lanes;
            }
            String base = kind.shortName() + bits;
            return lanes == 1 ? base : base + "x" + lanes;
        }
    }

    /**
     * A registry-defined scalar type. Only the code is known here; the printable
     * name comes from {@link DatatypeRegistry#getTypeName(int)}.
     */
    record Custom(int code, int bits, int lanes) implements DataType {
        public Custom {
            if (code < CUSTOM_BEGIN) {
                throw new IllegalArgumentException(
                    "Custom type code must be >= " + CUSTOM_BEGIN + ": " + code);
            }
            if (bits <= 0 || lanes <= 0) {
                throw new IllegalArgumentException("bits and lanes must be positive: " + bits + "x" + lanes);
            }
        }

        @Override
        public DataType withLanes(int lanes) {
            return new Custom(code, bits, lanes);
        }

        @Override
        public String toString() {
            String base = "custom[" + code + "]" + bits;
            return lanes == 1 ? base : base + "x" + lanes;
        }
    }
}
