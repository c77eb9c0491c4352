package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.dtype.DatatypeRegistry;
import io.surfworks.splitforge.core.dtype.UnknownTypeCodeException;

/**
 * Spells data types for one backend.
 *
 * <p>Built-in types come from a fixed table, with the backend choosing the names
 * of half, bfloat16 and vector types. Custom types print the name registered for
 * their code, verbatim.
 */
public final class TypeNameResolver {

    private final BackendPolicy policy;
    private final DatatypeRegistry registry;

    public TypeNameResolver(BackendPolicy policy, DatatypeRegistry registry) {
        this.policy = policy;
        this.registry = registry;
    }

    /**
     * @throws UnsupportedTypeException if the type has no spelling on this backend
     */
    public String typeName(DataType dtype) {
        if (dtype instanceof DataType.Custom c) {
            if (c.lanes() != 1) {
                throw unsupported(dtype);
            }
            try {
                return registry.getTypeName(c.code());
            } catch (UnknownTypeCodeException e) {
                throw new UnsupportedTypeException(dtype, policy.id(), e);
            }
        }
        DataType.BuiltIn b = (DataType.BuiltIn) dtype;
        String scalar = scalarName(b);
        if (b.lanes() == 1) {
            return scalar;
        }
        return vectorName(b, scalar);
    }

    private String scalarName(DataType.BuiltIn b) {
        if (b.isBool()) {
            return "bool";
        }
        String name = switch (b.kind()) {
            case INT -> switch (b.bits()) {
                case 8 -> "int8_t";
                case 16 -> "int16_t";
                case 32 -> "int";
                case 64 -> "int64_t";
                default -> null;
            };
            case UINT -> switch (b.bits()) {
                case 8 -> "uint8_t";
                case 16 -> "uint16_t";
                case 32 -> "unsigned int";
                case 64 -> "uint64_t";
                default -> null;
            };
            case FLOAT -> switch (b.bits()) {
                case 16 -> policy.halfType();
                case 32 -> "float";
                case 64 -> "double";
                default -> null;
            };
            case BFLOAT -> b.bits() == 16 ? policy.bfloatType() : null;
            case HANDLE -> "void*";
        };
        if (name == null) {
            throw unsupported(b);
        }
        return name;
    }

    private String vectorName(DataType.BuiltIn b, String scalar) {
        if (!policy.vectorTypes() || b.lanes() > 4) {
            throw unsupported(b);
        }
        return switch (scalar) {
            case "float", "int", "double" -> scalar + b.lanes();
            case "unsigned int" -> "uint" + b.lanes();
            case "half" -> {
                if (b.lanes() != 2) {
                    throw unsupported(b);
                }
                yield "half2";
            }
            default -> throw unsupported(b);
        };
    }

    private UnsupportedTypeException unsupported(DataType dtype) {
        return new UnsupportedTypeException(dtype, policy.id());
    }
}
