package io.surfworks.splitforge.core.ir;

import io.surfworks.splitforge.core.dtype.DataType;

import java.util.List;

/**
 * Expression nodes of the IR.
 *
 * <p>Nodes are immutable. Passes build new trees rather than mutating these.
 */
public sealed interface Expr permits Var, Expr.IntImm, Expr.FloatImm, Expr.StringImm,
        Expr.Binary, Expr.Not, Expr.Select, Expr.Cast, Expr.Load, Expr.Call, Expr.DescriptorGet {

    DataType dtype();

    static IntImm constant(long value) {
        return new IntImm(DataType.INT32, value);
    }

    static IntImm constant64(long value) {
        return new IntImm(DataType.INT64, value);
    }

    static Binary add(Expr a, Expr b) {
        return Binary.of(BinaryOp.ADD, a, b);
    }

    static Binary mul(Expr a, Expr b) {
        return Binary.of(BinaryOp.MUL, a, b);
    }

    static Binary eq(Expr a, Expr b) {
        return Binary.of(BinaryOp.EQ, a, b);
    }

    static Binary and(Expr a, Expr b) {
        return Binary.of(BinaryOp.AND, a, b);
    }

    static Binary lt(Expr a, Expr b) {
        return Binary.of(BinaryOp.LT, a, b);
    }

    // ==================== Leaves ====================

    record IntImm(DataType dtype, long value) implements Expr {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record FloatImm(DataType dtype, double value) implements Expr {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record StringImm(String value) implements Expr {
        @Override
        public DataType dtype() {
            return DataType.HANDLE;
        }
    }

    // ==================== Operators ====================

    record Binary(BinaryOp op, Expr a, Expr b, DataType dtype) implements Expr {
        /**
         * Build a binary node, deriving the result type from the operator.
         */
        public static Binary of(BinaryOp op, Expr a, Expr b) {
            DataType type = op.yieldsBool() ? DataType.BOOL.withLanes(a.dtype().lanes()) : a.dtype();
            return new Binary(op, a, b, type);
        }

        @Override
        public String toString() {
            return "(" + a + " " + op.symbol() + " " + b + ")";
        }
    }

    record Not(Expr a) implements Expr {
        @Override
        public DataType dtype() {
            return a.dtype();
        }
    }

    record Select(Expr condition, Expr trueValue, Expr falseValue) implements Expr {
        @Override
        public DataType dtype() {
            return trueValue.dtype();
        }
    }

    record Cast(DataType dtype, Expr value) implements Expr {
    }

    // ==================== Memory and calls ====================

    /**
     * Read {@code buffer[index]} as {@code dtype}.
     */
    record Load(DataType dtype, Var buffer, Expr index) implements Expr {
    }

    record Call(DataType dtype, String name, List<Expr> args, CallKind kind) implements Expr {
        public Call {
            args = List.copyOf(args);
        }
    }

    enum CallKind {
        /** Function resolved by the target toolchain. */
        EXTERN,
        /** Compiler intrinsic such as a barrier; printed by the code generator. */
        INTRINSIC
    }

    /**
     * Read a field of a runtime tensor descriptor.
     *
     * @param handle descriptor variable
     * @param field  field to read
     * @param index  dimension index for shape/strides, otherwise 0
     */
    record DescriptorGet(Var handle, DescriptorField field, int index) implements Expr {

        public static DescriptorGet of(Var handle, DescriptorField field) {
            return new DescriptorGet(handle, field, 0);
        }

        public static DescriptorGet of(Var handle, DescriptorField field, int index) {
            return new DescriptorGet(handle, field, index);
        }

        @Override
        public DataType dtype() {
            return field.dtype();
        }

        @Override
        public String toString() {
            return field.isIndexed()
                ? handle.name() + "." + field.memberName() + "[" + index + "]"
                : handle.name() + "." + field.memberName();
        }
    }
}
