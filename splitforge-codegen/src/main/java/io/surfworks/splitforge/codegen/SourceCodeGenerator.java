package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.ir.DescriptorField;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.Expr.Binary;
import io.surfworks.splitforge.core.ir.Expr.Call;
import io.surfworks.splitforge.core.ir.Expr.Cast;
import io.surfworks.splitforge.core.ir.Expr.DescriptorGet;
import io.surfworks.splitforge.core.ir.Expr.FloatImm;
import io.surfworks.splitforge.core.ir.Expr.IntImm;
import io.surfworks.splitforge.core.ir.Expr.Load;
import io.surfworks.splitforge.core.ir.Expr.Not;
import io.surfworks.splitforge.core.ir.Expr.Select;
import io.surfworks.splitforge.core.ir.Expr.StringImm;
import io.surfworks.splitforge.core.ir.IrVisitor;
import io.surfworks.splitforge.core.ir.Stmt;
import io.surfworks.splitforge.core.ir.Stmt.Allocate;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Stmt.AttrStmt;
import io.surfworks.splitforge.core.ir.Stmt.Evaluate;
import io.surfworks.splitforge.core.ir.Stmt.For;
import io.surfworks.splitforge.core.ir.Stmt.IfThenElse;
import io.surfworks.splitforge.core.ir.Stmt.LaunchKernel;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.SeqStmt;
import io.surfworks.splitforge.core.ir.Stmt.Store;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;
import io.surfworks.splitforge.core.ir.Var;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Shared printing of statements and expressions as C-family source.
 *
 * <p>Subclasses print function signatures and the statements that only exist on
 * one side of the split: thread extents on the device, argument checks and
 * kernel launches on the host.
 *
 * <p>Variables are named on first sight. A name already taken in the current
 * function gets a numeric suffix, so two distinct variables sharing a name hint
 * never collide in the output.
 */
public abstract class SourceCodeGenerator {

    protected final BackendPolicy policy;
    protected final TypeNameResolver types;
    protected final StringBuilder out = new StringBuilder();

    private final Map<Var, String> names = new HashMap<>();
    private final Set<String> usedNames = new HashSet<>();
    private final Set<Var> volatileBuffers = new HashSet<>();
    private final Set<Var> localArrays = new HashSet<>();
    private int indent;
    private boolean inert;

    protected SourceCodeGenerator(BackendPolicy policy, TypeNameResolver types) {
        this.policy = policy;
        this.types = types;
    }

    public BackendPolicy policy() {
        return policy;
    }

    // ==================== Function scope ====================

    /**
     * Reset per-function naming state and record which buffers {@code body} marks
     * volatile.
     */
    protected void beginFunction(Stmt body) {
        names.clear();
        usedNames.clear();
        volatileBuffers.clear();
        localArrays.clear();
        indent = 0;
        new IrVisitor() {
            @Override
            protected void visitAttr(AttrStmt s) {
                if (AttrStmt.VOLATILE_SCOPE.equals(s.key()) && s.node() != null) {
                    volatileBuffers.add(s.node());
                }
                super.visitAttr(s);
            }
        }.visitStmt(body);
    }

    protected boolean isVolatile(Var buffer) {
        return volatileBuffers.contains(buffer);
    }

    /**
     * The printed name of {@code v}, allocating one if needed.
     */
    protected String nameOf(Var v) {
        String existing = names.get(v);
        if (existing != null) {
            return existing;
        }
        if (inert) {
            return sanitize(v.name());
        }
        String base = sanitize(v.name());
        String candidate = base;
        int suffix = 1;
        while (!usedNames.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        names.put(v, candidate);
        return candidate;
    }

    private static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * Print {@code expr} for a comment. Variables not yet named print under their
     * name hint and stay unnamed, so the code that follows is unaffected.
     */
    protected String printInert(Expr expr) {
        inert = true;
        try {
            return printExpr(expr);
        } finally {
            inert = false;
        }
    }

    // ==================== Output helpers ====================

    protected void line(String text) {
        for (int i = 0; i < indent; i++) {
            out.append("  ");
        }
        out.append(text).append('\n');
    }

    protected void openBlock(String header) {
        line(header.isEmpty() ? "{" : header + " {");
        indent++;
    }

    protected void closeBlock() {
        indent--;
        line("}");
    }

    protected void printHeaders() {
        for (String header : policy.headers()) {
            out.append("#include <").append(header).append(">\n");
        }
        out.append('\n');
    }

    /**
     * Declaration of a pointer parameter. With cast-wrapped access the pointer is
     * untyped; otherwise it carries its element type.
     */
    protected String pointerParam(Var v) {
        String restrict = policy.hasRestrict() ? " " + policy.restrictKeyword() : "";
        if (policy.castBufferAccess() || v.elementType() == null) {
            return "void*" + restrict + " " + nameOf(v);
        }
        String qualifier = isVolatile(v) ? "volatile " : "";
        return qualifier + types.typeName(v.elementType()) + "*" + restrict + " " + nameOf(v);
    }

    // ==================== Statements ====================

    protected void printStmt(Stmt stmt) {
        if (stmt instanceof SeqStmt s) {
            for (Stmt child : s.stmts()) {
                printStmt(child);
            }
        } else if (stmt instanceof LetStmt s) {
            printLet(s);
        } else if (stmt instanceof AttrStmt s) {
            printAttr(s);
        } else if (stmt instanceof ThreadExtent s) {
            printThreadExtent(s);
        } else if (stmt instanceof For s) {
            printFor(s);
        } else if (stmt instanceof IfThenElse s) {
            openBlock("if (" + printExpr(s.condition()) + ")");
            printStmt(s.thenCase());
            if (s.elseCase() != null) {
                indent--;
                line("} else {");
                indent++;
                printStmt(s.elseCase());
            }
            closeBlock();
        } else if (stmt instanceof Allocate s) {
            printAllocate(s);
        } else if (stmt instanceof Store s) {
            line(bufferRef(s.buffer(), s.value().dtype(), s.index()) + " = " + printExpr(s.value()) + ";");
        } else if (stmt instanceof Evaluate s) {
            line(printExpr(s.value()) + ";");
        } else if (stmt instanceof AssertStmt s) {
            printAssert(s);
        } else if (stmt instanceof LaunchKernel s) {
            printLaunch(s);
        } else {
            throw new IllegalStateException("Unknown statement: " + stmt.getClass().getSimpleName());
        }
    }

    /**
     * A bound pointer with a known element type is declared typed unless the
     * backend casts at each access.
     */
    protected void printLet(LetStmt s) {
        Var v = s.var();
        if (v.dtype().isHandle() && v.elementType() != null && !policy.castBufferAccess()) {
            String ptr = (isVolatile(v) ? "volatile " : "") + types.typeName(v.elementType()) + "*";
            line(ptr + " " + nameOf(v) + " = (" + ptr + ")" + printExpr(s.value()) + ";");
        } else {
            line(types.typeName(v.dtype()) + " " + nameOf(v) + " = " + printExpr(s.value()) + ";");
        }
        printStmt(s.body());
    }

    protected void printAttr(AttrStmt s) {
        if (AttrStmt.PRAGMA_UNROLL.equals(s.key())) {
            line("#pragma unroll");
        }
        printStmt(s.body());
    }

    protected void printFor(For s) {
        if (s.kind() == Stmt.ForKind.UNROLLED) {
            line("#pragma unroll");
        }
        String var = nameOf(s.loopVar());
        String type = types.typeName(s.loopVar().dtype());
        String min = printExpr(s.min());
        Expr end = s.min() instanceof IntImm m && m.value() == 0 ? s.extent() : Expr.add(s.min(), s.extent());
        openBlock("for (" + type + " " + var + " = " + min + "; " + var + " < " + printExpr(end) + "; ++" + var + ")");
        printStmt(s.body());
        closeBlock();
    }

    protected void printAllocate(Allocate s) {
        localArrays.add(s.buffer());
        Expr size = s.extents().get(0);
        for (int i = 1; i < s.extents().size(); i++) {
            size = Expr.mul(size, s.extents().get(i));
        }
        String qualifier = "shared".equals(s.storageScope()) && !policy.sharedQualifier().isEmpty()
            ? policy.sharedQualifier() + " " : "";
        String vol = isVolatile(s.buffer()) ? "volatile " : "";
        line(qualifier + vol + types.typeName(s.dtype()) + " " + nameOf(s.buffer()) + "[" + printExpr(size) + "];");
        printStmt(s.body());
    }

    protected void printThreadExtent(ThreadExtent s) {
        throw new IllegalStateException("Thread extent " + s.iterVar().threadTag()
            + " outside device code; split the function first");
    }

    protected void printAssert(AssertStmt s) {
        throw new IllegalStateException("Argument check is only valid in host code: " + s.message());
    }

    protected void printLaunch(LaunchKernel s) {
        throw new IllegalStateException("Kernel launch is only valid in host code: " + s.kernelName());
    }

    // ==================== Expressions ====================

    protected String printExpr(Expr expr) {
        if (expr instanceof Var v) {
            return nameOf(v);
        } else if (expr instanceof IntImm imm) {
            return printInt(imm);
        } else if (expr instanceof FloatImm imm) {
            return printFloat(imm);
        } else if (expr instanceof StringImm imm) {
            return "\"" + imm.value().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        } else if (expr instanceof Binary b) {
            if (b.op().isFunctionStyle()) {
                return b.op().symbol() + "(" + printExpr(b.a()) + ", " + printExpr(b.b()) + ")";
            }
            return "(" + printExpr(b.a()) + " " + b.op().symbol() + " " + printExpr(b.b()) + ")";
        } else if (expr instanceof Not n) {
            return "(!" + printExpr(n.a()) + ")";
        } else if (expr instanceof Select s) {
            return "(" + printExpr(s.condition()) + " ? " + printExpr(s.trueValue())
                + " : " + printExpr(s.falseValue()) + ")";
        } else if (expr instanceof Cast c) {
            return "((" + types.typeName(c.dtype()) + ")" + printExpr(c.value()) + ")";
        } else if (expr instanceof Load l) {
            return bufferRef(l.buffer(), l.dtype(), l.index());
        } else if (expr instanceof Call c) {
            return printCall(c);
        } else if (expr instanceof DescriptorGet d) {
            return printDescriptorGet(d);
        }
        throw new IllegalStateException("Unknown expression: " + expr.getClass().getSimpleName());
    }

    private String printInt(IntImm imm) {
        DataType t = imm.dtype();
        if (t.isBool()) {
            return imm.value() != 0 ? "true" : "false";
        }
        if (t.equals(DataType.INT32)) {
            return Long.toString(imm.value());
        }
        return "((" + types.typeName(t) + ")" + imm.value() + ")";
    }

    private String printFloat(FloatImm imm) {
        DataType t = imm.dtype();
        if (t.equals(DataType.FLOAT64)) {
            return Double.toString(imm.value());
        }
        String literal = Float.toString((float) imm.value()) + "f";
        if (t.equals(DataType.FLOAT32)) {
            return literal;
        }
        return "((" + types.typeName(t) + ")" + literal + ")";
    }

    private String printCall(Call c) {
        if (c.kind() == Expr.CallKind.INTRINSIC && "sync_threads".equals(c.name())) {
            String barrier = policy.barrier();
            return barrier.endsWith(";") ? barrier.substring(0, barrier.length() - 1) : barrier;
        }
        StringBuilder sb = new StringBuilder(c.name()).append('(');
        for (int i = 0; i < c.args().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(printExpr(c.args().get(i)));
        }
        return sb.append(')').toString();
    }

    protected String printDescriptorGet(DescriptorGet d) {
        String handle = nameOf(d.handle());
        DescriptorField field = d.field();
        if (field == DescriptorField.HAS_STRIDES) {
            return "(" + handle + "->strides != NULL)";
        }
        if (field.isIndexed()) {
            return handle + "->" + field.memberName() + "[" + d.index() + "]";
        }
        return handle + "->" + field.memberName();
    }

    /**
     * Element {@code index} of {@code buffer}, read or written as {@code elementType}.
     */
    protected String bufferRef(Var buffer, DataType elementType, Expr index) {
        String name = nameOf(buffer);
        String idx = printExpr(index);
        if (localArrays.contains(buffer)) {
            return name + "[" + idx + "]";
        }
        boolean typedParam = !policy.castBufferAccess()
            && buffer.elementType() != null
            && buffer.elementType().equals(elementType);
        if (typedParam) {
            return name + "[" + idx + "]";
        }
        String vol = isVolatile(buffer) ? "volatile " : "";
        return "((" + vol + types.typeName(elementType) + "*)" + name + ")[" + idx + "]";
    }
}
