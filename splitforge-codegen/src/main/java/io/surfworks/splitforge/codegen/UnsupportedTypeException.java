package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.core.dtype.DataType;

/**
 * A data type has no spelling on the selected backend: neither the built-in
 * table nor the datatype registry knows it.
 */
public class UnsupportedTypeException extends RuntimeException {

    private final transient DataType dtype;
    private final String backend;

    public UnsupportedTypeException(DataType dtype, String backend) {
        this(dtype, backend, null);
    }

    public UnsupportedTypeException(DataType dtype, String backend, Throwable cause) {
        super("Type " + dtype + " is not supported by backend '" + backend + "'", cause);
        this.dtype = dtype;
        this.backend = backend;
    }

    public DataType dtype() {
        return dtype;
    }

    public String backend() {
        return backend;
    }
}
