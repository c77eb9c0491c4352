package io.surfworks.splitforge.core.ir;

import io.surfworks.splitforge.core.dtype.DataType;

import java.util.ArrayList;
import java.util.List;

/**
 * Compile-time description of a tensor argument.
 *
 * <p>Shape and stride entries are either {@link Expr.IntImm} constants or
 * symbolic {@link Var}s bound from the runtime descriptor. An empty stride list
 * means compact row-major layout.
 *
 * @param name    argument name used in diagnostics
 * @param dtype   element type
 * @param data    pointer variable the kernel body indexes
 * @param shape   extent of each dimension
 * @param strides element stride of each dimension, or empty
 * @param kind    whether the kernel reads or writes the buffer
 */
public record BufferDeclaration(
    String name,
    DataType dtype,
    Var data,
    List<Expr> shape,
    List<Expr> strides,
    Kind kind
) {
    public enum Kind { INPUT, OUTPUT }

    public BufferDeclaration {
        shape = List.copyOf(shape);
        strides = List.copyOf(strides);
        if (!strides.isEmpty() && strides.size() != shape.size()) {
            throw new IllegalArgumentException(
                "Buffer " + name + " declares " + strides.size() + " strides for rank " + shape.size());
        }
        if (!data.dtype().isHandle()) {
            throw new IllegalArgumentException("Buffer " + name + " data var must be a handle");
        }
    }

    /**
     * Declare a compact buffer with a fresh data pointer named after the buffer.
     */
    public static BufferDeclaration of(String name, DataType dtype, List<Expr> shape, Kind kind) {
        return new BufferDeclaration(name, dtype, Var.pointer(name, dtype), shape, List.of(), kind);
    }

    public int rank() {
        return shape.size();
    }

    public boolean isCompact() {
        return strides.isEmpty();
    }

    /**
     * Symbolic variables appearing in the shape or strides, in declaration order.
     */
    public List<Var> symbolicVars() {
        List<Var> vars = new ArrayList<>();
        for (Expr e : shape) {
            if (e instanceof Var v && !vars.contains(v)) {
                vars.add(v);
            }
        }
        for (Expr e : strides) {
            if (e instanceof Var v && !vars.contains(v)) {
                vars.add(v);
            }
        }
        return vars;
    }
}
