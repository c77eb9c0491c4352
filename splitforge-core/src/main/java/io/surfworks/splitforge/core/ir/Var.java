package io.surfworks.splitforge.core.ir;

import io.surfworks.splitforge.core.dtype.DataType;

/**
 * An IR variable.
 *
 * <p>Variables compare by identity: two {@code Var}s named {@code n} are
 * different variables. The name is only a hint for printing.
 *
 * <p>Handle-typed variables may carry the element type they point to, which code
 * generators use to print typed pointers.
 */
public final class Var implements Expr {

    private final String name;
    private final DataType dtype;
    private final DataType elementType;

    public Var(String name, DataType dtype) {
        this(name, dtype, null);
    }

    private Var(String name, DataType dtype, DataType elementType) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name must not be empty");
        }
        if (dtype == null) {
            throw new IllegalArgumentException("Variable dtype must not be null");
        }
        this.name = name;
        this.dtype = dtype;
        this.elementType = elementType;
    }

    /**
     * Create a pointer variable whose pointee type is {@code elementType}.
     */
    public static Var pointer(String name, DataType elementType) {
        return new Var(name, DataType.HANDLE, elementType);
    }

    public static Var int32(String name) {
        return new Var(name, DataType.INT32);
    }

    public String name() {
        return name;
    }

    @Override
    public DataType dtype() {
        return dtype;
    }

    /**
     * Pointee type of a handle, or null when unknown or not a handle.
     */
    public DataType elementType() {
        return elementType;
    }

    /**
     * A fresh variable with the same name and types.
     */
    public Var copy() {
        return new Var(name, dtype, elementType);
    }

    @Override
    public String toString() {
        return name;
    }
}
