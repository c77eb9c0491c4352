package io.surfworks.splitforge.core.runtime;

import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.dtype.ScalarKind;
import io.surfworks.splitforge.core.ir.DescriptorField;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.Expr.Binary;
import io.surfworks.splitforge.core.ir.Expr.Cast;
import io.surfworks.splitforge.core.ir.Expr.DescriptorGet;
import io.surfworks.splitforge.core.ir.Expr.FloatImm;
import io.surfworks.splitforge.core.ir.Expr.IntImm;
import io.surfworks.splitforge.core.ir.Expr.Not;
import io.surfworks.splitforge.core.ir.Expr.Select;
import io.surfworks.splitforge.core.ir.Expr.StringImm;
import io.surfworks.splitforge.core.ir.Var;

import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates host-side scalar expressions against concrete values.
 *
 * <p>Integers evaluate to {@link Long}, floats to {@link Double}, booleans to
 * {@link Boolean}. A handle variable bound to a {@link TensorDescriptor} can be
 * read through {@link DescriptorGet}. Buffer loads and calls have no host value
 * and are rejected.
 */
public final class ExprEvaluator {

    private final Map<Var, Object> env;

    public ExprEvaluator() {
        this(new HashMap<>());
    }

    public ExprEvaluator(Map<Var, Object> bindings) {
        this.env = new HashMap<>(bindings);
    }

    public void bind(Var var, Object value) {
        env.put(var, value);
    }

    public void unbind(Var var) {
        env.remove(var);
    }

    public Object lookup(Var var) {
        if (!env.containsKey(var)) {
            throw new IllegalStateException("Unbound variable: " + var.name());
        }
        return env.get(var);
    }

    public boolean evaluateBool(Expr expr) {
        Object value = evaluate(expr);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Long l) {
            return l != 0;
        }
        throw new IllegalStateException("Expected boolean from " + expr + ", got " + value);
    }

    public long evaluateLong(Expr expr) {
        Object value = evaluate(expr);
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        throw new IllegalStateException("Expected integer from " + expr + ", got " + value);
    }

    public Object evaluate(Expr expr) {
        if (expr instanceof Var v) {
            return lookup(v);
        } else if (expr instanceof IntImm imm) {
            return imm.dtype().isBool() ? imm.value() != 0 : imm.value();
        } else if (expr instanceof FloatImm imm) {
            return imm.value();
        } else if (expr instanceof StringImm imm) {
            return imm.value();
        } else if (expr instanceof Binary b) {
            return evaluateBinary(b);
        } else if (expr instanceof Not n) {
            return !evaluateBool(n.a());
        } else if (expr instanceof Select s) {
            return evaluateBool(s.condition()) ? evaluate(s.trueValue()) : evaluate(s.falseValue());
        } else if (expr instanceof Cast c) {
            return cast(c.dtype(), evaluate(c.value()));
        } else if (expr instanceof DescriptorGet d) {
            return readField(d);
        }
        throw new UnsupportedOperationException(
            "Cannot evaluate " + expr.getClass().getSimpleName() + " on the host: " + expr);
    }

    private Object evaluateBinary(Binary b) {
        switch (b.op()) {
            case AND:
                return evaluateBool(b.a()) && evaluateBool(b.b());
            case OR:
                return evaluateBool(b.a()) || evaluateBool(b.b());
            default:
                break;
        }
        Object lhs = evaluate(b.a());
        Object rhs = evaluate(b.b());
        if (lhs instanceof Double || rhs instanceof Double) {
            return floatingOp(b, toDouble(lhs), toDouble(rhs));
        }
        return integerOp(b, toLong(lhs), toLong(rhs));
    }

    private static Object integerOp(Binary b, long x, long y) {
        return switch (b.op()) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> Math.floorDiv(x, y);
            case MOD -> Math.floorMod(x, y);
            case MIN -> Math.min(x, y);
            case MAX -> Math.max(x, y);
            case EQ -> x == y;
            case NE -> x != y;
            case LT -> x < y;
            case LE -> x <= y;
            case GT -> x > y;
            case GE -> x >= y;
            case AND, OR -> throw new IllegalStateException("logical op handled earlier");
        };
    }

    private static Object floatingOp(Binary b, double x, double y) {
        return switch (b.op()) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> x / y;
            case MOD -> x % y;
            case MIN -> Math.min(x, y);
            case MAX -> Math.max(x, y);
            case EQ -> x == y;
            case NE -> x != y;
            case LT -> x < y;
            case LE -> x <= y;
            case GT -> x > y;
            case GE -> x >= y;
            case AND, OR -> throw new IllegalStateException("logical op handled earlier");
        };
    }

    private Object readField(DescriptorGet d) {
        Object bound = lookup(d.handle());
        if (!(bound instanceof TensorDescriptor t)) {
            throw new IllegalStateException(
                "Handle " + d.handle().name() + " is not bound to a tensor descriptor: " + bound);
        }
        DescriptorField field = d.field();
        return switch (field) {
            case DEVICE_TYPE -> (long) t.deviceType();
            case DEVICE_ID -> (long) t.deviceId();
            case NDIM -> (long) t.ndim();
            case TYPE_CODE -> (long) t.typeCode();
            case TYPE_BITS -> (long) t.typeBits();
            case TYPE_LANES -> (long) t.typeLanes();
            case SHAPE -> t.shape()[d.index()];
            case STRIDES -> t.stride(d.index());
            case HAS_STRIDES -> t.strides() != null;
            case BYTE_OFFSET -> t.byteOffset();
            case DATA -> t.data();
        };
    }

    private static Object cast(DataType target, Object value) {
        if (target.isBool()) {
            return value instanceof Boolean b ? b : toDouble(value) != 0;
        }
        if (target instanceof DataType.BuiltIn b && b.kind().isFloating()) {
            return toDouble(value);
        }
        long v = toLong(value);
        if (target instanceof DataType.BuiltIn b && b.kind() == ScalarKind.UINT && b.bits() < 64) {
            return v & ((1L << b.bits()) - 1);
        }
        if (target instanceof DataType.BuiltIn b && b.kind() == ScalarKind.INT && b.bits() < 64) {
            int shift = 64 - b.bits();
            return (v << shift) >> shift;
        }
        return v;
    }

    private static long toLong(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Double d) {
            return d.longValue();
        }
        throw new IllegalStateException("Not an integer value: " + value);
    }

    private static double toDouble(Object value) {
        if (value instanceof Double d) {
            return d;
        }
        return toLong(value);
    }
}
