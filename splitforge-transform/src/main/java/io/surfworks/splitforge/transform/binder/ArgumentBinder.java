package io.surfworks.splitforge.transform.binder;

import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.ir.BinaryOp;
import io.surfworks.splitforge.core.ir.BufferDeclaration;
import io.surfworks.splitforge.core.ir.DescriptorField;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.Expr.Binary;
import io.surfworks.splitforge.core.ir.Expr.Cast;
import io.surfworks.splitforge.core.ir.Expr.DescriptorGet;
import io.surfworks.splitforge.core.ir.Expr.IntImm;
import io.surfworks.splitforge.core.ir.Expr.Select;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.MismatchKind;
import io.surfworks.splitforge.core.ir.Var;
import io.surfworks.splitforge.transform.binder.BufferBinding.Binding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.logging.Logger;

/**
 * Generates the runtime checks that validate tensor arguments against their
 * declarations, and the bindings that extract pointers and symbolic extents.
 *
 * <p>A binder remembers the symbolic variables it has bound. The first occurrence
 * of a symbolic extent binds it; every later occurrence, in the same buffer or a
 * later one, becomes an equality check against the descriptor field it was first
 * bound from. Checks only ever read descriptor fields, so they are valid at any
 * point of the entry sequence.
 *
 * <p>Built-in element types must match code, bits and lanes exactly. A custom
 * declaration accepts any runtime code at or above {@link DataType#CUSTOM_BEGIN}
 * and compares nothing else, so one custom type passes for another.
 *
 * <p>Extents are compared at the width of the descriptor field. A declared
 * {@code int32} extent is widened rather than the runtime value narrowed.
 *
 * <p>Use one binder per function.
 */
public final class ArgumentBinder {

    private static final Logger LOG = Logger.getLogger(ArgumentBinder.class.getName());

    private static final Expr TRUE = new IntImm(DataType.BOOL, 1);

    private final Map<Var, Expr> firstBinding = new HashMap<>();

    /**
     * Generate checks and extractions for one argument.
     *
     * @param declaration what the function expects
     * @param handle      descriptor variable holding the argument at run time
     */
    public BufferBinding bindBuffer(BufferDeclaration declaration, Var handle) {
        if (!handle.dtype().isHandle()) {
            throw new IllegalArgumentException("Descriptor " + handle.name() + " must be a handle");
        }
        String arg = declaration.name();
        List<AssertStmt> assertions = new ArrayList<>();
        List<Binding> extractions = new ArrayList<>();

        bindType(declaration.dtype(), handle, arg, assertions);

        int rank = declaration.rank();
        assertions.add(check(MismatchKind.SHAPE, arg, "ndim",
            field(handle, DescriptorField.NDIM), new IntImm(DataType.INT32, rank)));

        for (int i = 0; i < rank; i++) {
            bindExtent(declaration.shape().get(i), DescriptorGet.of(handle, DescriptorField.SHAPE, i),
                arg, "shape[" + i + "]", assertions, extractions);
        }

        if (declaration.isCompact()) {
            for (int i = 0; i < rank; i++) {
                Expr actual = DescriptorGet.of(handle, DescriptorField.STRIDES, i);
                Expr expected = compactStride(handle, rank, i);
                Expr condition = new Select(field(handle, DescriptorField.HAS_STRIDES),
                    Expr.eq(actual, expected), TRUE);
                assertions.add(new AssertStmt(condition, MismatchKind.SHAPE, arg,
                    "strides[" + i + "]", expected, actual));
            }
        } else {
            for (int i = 0; i < rank; i++) {
                bindExtent(declaration.strides().get(i), DescriptorGet.of(handle, DescriptorField.STRIDES, i),
                    arg, "strides[" + i + "]", assertions, extractions);
            }
        }

        assertions.add(check(MismatchKind.SHAPE, arg, "byte_offset",
            field(handle, DescriptorField.BYTE_OFFSET), new IntImm(DescriptorField.BYTE_OFFSET.dtype(), 0)));

        extractions.add(new Binding(declaration.data(), field(handle, DescriptorField.DATA)));

        Expr checkExpr = assertions.get(0).condition();
        for (int i = 1; i < assertions.size(); i++) {
            checkExpr = Expr.and(checkExpr, assertions.get(i).condition());
        }

        LOG.fine(() -> "Bound " + arg + ": " + assertions.size() + " check(s), "
            + extractions.size() + " extraction(s)");
        return new BufferBinding(declaration, handle, checkExpr, assertions, extractions);
    }

    /**
     * Prepend the argument-validation entry sequence to {@code function}.
     *
     * <p>Buffers are bound in declaration order. Each buffer's checks run before its
     * extractions; the device type and id of the first buffer are bound to
     * {@code device_type} and {@code device_id}.
     */
    public static PrimFunc bindFunction(PrimFunc function) {
        if (function.bufferMap().isEmpty()) {
            return function;
        }
        ArgumentBinder binder = new ArgumentBinder();
        List<BufferBinding> bindings = new ArrayList<>();
        for (Entry<Var, BufferDeclaration> e : function.bufferMap().entrySet()) {
            bindings.add(binder.bindBuffer(e.getValue(), e.getKey()));
        }

        Var firstHandle = bindings.get(0).handle();
        List<Binding> deviceBindings = List.of(
            new Binding(Var.int32("device_type"), field(firstHandle, DescriptorField.DEVICE_TYPE)),
            new Binding(Var.int32("device_id"), field(firstHandle, DescriptorField.DEVICE_ID)));

        Stmt body = wrap(deviceBindings, function.body());
        for (int i = bindings.size() - 1; i >= 0; i--) {
            BufferBinding b = bindings.get(i);
            body = wrap(b.extractions(), body);
            List<Stmt> sequence = new ArrayList<>(b.assertions());
            sequence.add(body);
            body = Stmt.seq(sequence);
        }
        LOG.fine(() -> "Bound " + bindings.size() + " argument(s) of " + function.name());
        return function.withBody(body);
    }

    private static Stmt wrap(List<Binding> bindings, Stmt body) {
        Stmt result = body;
        for (int i = bindings.size() - 1; i >= 0; i--) {
            Binding b = bindings.get(i);
            result = new LetStmt(b.var(), b.value(), result);
        }
        return result;
    }

    private static void bindType(DataType dtype, Var handle, String arg, List<AssertStmt> out) {
        DescriptorGet code = field(handle, DescriptorField.TYPE_CODE);
        if (dtype.isCustom()) {
            IntImm begin = new IntImm(code.dtype(), DataType.CUSTOM_BEGIN);
            out.add(new AssertStmt(Binary.of(BinaryOp.GE, code, begin), MismatchKind.TYPE, arg,
                "dtype.code", begin, code));
            return;
        }
        out.add(check(MismatchKind.TYPE, arg, "dtype.code", code, new IntImm(code.dtype(), dtype.code())));
        DescriptorGet bits = field(handle, DescriptorField.TYPE_BITS);
        out.add(check(MismatchKind.TYPE, arg, "dtype.bits", bits, new IntImm(bits.dtype(), dtype.bits())));
        DescriptorGet lanes = field(handle, DescriptorField.TYPE_LANES);
        out.add(check(MismatchKind.TYPE, arg, "dtype.lanes", lanes, new IntImm(lanes.dtype(), dtype.lanes())));
    }

    private void bindExtent(Expr declared, DescriptorGet actual, String arg, String fieldName,
                            List<AssertStmt> assertions, List<Binding> extractions) {
        if (declared instanceof Var v) {
            Expr bound = firstBinding.get(v);
            if (bound == null) {
                Expr value = v.dtype().equals(actual.dtype()) ? actual : new Cast(v.dtype(), actual);
                firstBinding.put(v, value);
                extractions.add(new Binding(v, value));
                return;
            }
            assertions.add(check(MismatchKind.SHAPE, arg, fieldName, actual, widen(bound, actual.dtype())));
        } else {
            assertions.add(check(MismatchKind.SHAPE, arg, fieldName, actual, widen(declared, actual.dtype())));
        }
    }

    private static Expr widen(Expr value, DataType dtype) {
        if (value.dtype().equals(dtype)) {
            return value;
        }
        if (value instanceof IntImm imm) {
            return new IntImm(dtype, imm.value());
        }
        return new Cast(dtype, value);
    }

    private static Expr compactStride(Var handle, int rank, int dim) {
        Expr stride = Expr.constant64(1);
        for (int d = rank - 1; d > dim; d--) {
            Expr extent = DescriptorGet.of(handle, DescriptorField.SHAPE, d);
            stride = d == rank - 1 ? extent : Expr.mul(extent, stride);
        }
        return stride;
    }

    private static AssertStmt check(MismatchKind kind, String arg, String fieldName, Expr actual, Expr expected) {
        return new AssertStmt(Expr.eq(actual, expected), kind, arg, fieldName, expected, actual);
    }

    private static DescriptorGet field(Var handle, DescriptorField field) {
        return DescriptorGet.of(handle, field);
    }
}
