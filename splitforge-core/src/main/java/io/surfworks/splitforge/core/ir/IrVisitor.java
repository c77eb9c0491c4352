package io.surfworks.splitforge.core.ir;

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
import io.surfworks.splitforge.core.ir.Stmt.Allocate;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Stmt.AttrStmt;
import io.surfworks.splitforge.core.ir.Stmt.Evaluate;
import io.surfworks.splitforge.core.ir.Stmt.For;
import io.surfworks.splitforge.core.ir.Stmt.IfThenElse;
import io.surfworks.splitforge.core.ir.Stmt.LaunchExtent;
import io.surfworks.splitforge.core.ir.Stmt.LaunchKernel;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.SeqStmt;
import io.surfworks.splitforge.core.ir.Stmt.Store;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;

/**
 * Read-only walk over an IR tree.
 *
 * <p>The default implementation of every {@code visit*} method visits the node's
 * children in source order. Subclasses override the nodes they care about and call
 * {@code super} to keep descending.
 */
public abstract class IrVisitor {

    public void visitStmt(Stmt stmt) {
        if (stmt instanceof LetStmt s) {
            visitLet(s);
        } else if (stmt instanceof AttrStmt s) {
            visitAttr(s);
        } else if (stmt instanceof ThreadExtent s) {
            visitThreadExtent(s);
        } else if (stmt instanceof For s) {
            visitFor(s);
        } else if (stmt instanceof IfThenElse s) {
            visitIfThenElse(s);
        } else if (stmt instanceof SeqStmt s) {
            visitSeq(s);
        } else if (stmt instanceof Allocate s) {
            visitAllocate(s);
        } else if (stmt instanceof Store s) {
            visitStore(s);
        } else if (stmt instanceof Evaluate s) {
            visitEvaluate(s);
        } else if (stmt instanceof AssertStmt s) {
            visitAssert(s);
        } else if (stmt instanceof LaunchKernel s) {
            visitLaunchKernel(s);
        } else {
            throw new IllegalStateException("Unhandled statement: " + stmt.getClass().getSimpleName());
        }
    }

    public void visitExpr(Expr expr) {
        if (expr instanceof Var v) {
            visitVar(v);
        } else if (expr instanceof IntImm || expr instanceof FloatImm || expr instanceof StringImm) {
            visitConstant(expr);
        } else if (expr instanceof Binary e) {
            visitBinary(e);
        } else if (expr instanceof Not e) {
            visitExpr(e.a());
        } else if (expr instanceof Select e) {
            visitSelect(e);
        } else if (expr instanceof Cast e) {
            visitExpr(e.value());
        } else if (expr instanceof Load e) {
            visitLoad(e);
        } else if (expr instanceof Call e) {
            visitCall(e);
        } else if (expr instanceof DescriptorGet e) {
            visitDescriptorGet(e);
        } else {
            throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
        }
    }

    // ==================== Statements ====================

    protected void visitLet(LetStmt s) {
        visitExpr(s.value());
        visitStmt(s.body());
    }

    protected void visitAttr(AttrStmt s) {
        if (s.node() != null) {
            visitVar(s.node());
        }
        visitExpr(s.value());
        visitStmt(s.body());
    }

    protected void visitThreadExtent(ThreadExtent s) {
        visitExpr(s.extent());
        visitStmt(s.body());
    }

    protected void visitFor(For s) {
        visitExpr(s.min());
        visitExpr(s.extent());
        visitStmt(s.body());
    }

    protected void visitIfThenElse(IfThenElse s) {
        visitExpr(s.condition());
        visitStmt(s.thenCase());
        if (s.elseCase() != null) {
            visitStmt(s.elseCase());
        }
    }

    protected void visitSeq(SeqStmt s) {
        for (Stmt stmt : s.stmts()) {
            visitStmt(stmt);
        }
    }

    protected void visitAllocate(Allocate s) {
        for (Expr extent : s.extents()) {
            visitExpr(extent);
        }
        visitStmt(s.body());
    }

    protected void visitStore(Store s) {
        visitVar(s.buffer());
        visitExpr(s.value());
        visitExpr(s.index());
    }

    protected void visitEvaluate(Evaluate s) {
        visitExpr(s.value());
    }

    protected void visitAssert(AssertStmt s) {
        visitExpr(s.condition());
        visitExpr(s.expected());
        visitExpr(s.actual());
    }

    protected void visitLaunchKernel(LaunchKernel s) {
        for (Expr arg : s.arguments()) {
            visitExpr(arg);
        }
        for (LaunchExtent extent : s.launchExtents()) {
            visitExpr(extent.extent());
        }
    }

    // ==================== Expressions ====================

    protected void visitVar(Var v) {
    }

    protected void visitConstant(Expr constant) {
    }

    protected void visitBinary(Binary e) {
        visitExpr(e.a());
        visitExpr(e.b());
    }

    protected void visitSelect(Select e) {
        visitExpr(e.condition());
        visitExpr(e.trueValue());
        visitExpr(e.falseValue());
    }

    protected void visitLoad(Load e) {
        visitVar(e.buffer());
        visitExpr(e.index());
    }

    protected void visitCall(Call e) {
        for (Expr arg : e.args()) {
            visitExpr(arg);
        }
    }

    protected void visitDescriptorGet(DescriptorGet e) {
        visitVar(e.handle());
    }
}
