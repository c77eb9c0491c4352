package io.surfworks.splitforge.core.ir;

import io.surfworks.splitforge.core.ir.Expr.Binary;
import io.surfworks.splitforge.core.ir.Expr.Call;
import io.surfworks.splitforge.core.ir.Expr.Cast;
import io.surfworks.splitforge.core.ir.Expr.DescriptorGet;
import io.surfworks.splitforge.core.ir.Expr.Load;
import io.surfworks.splitforge.core.ir.Expr.Not;
import io.surfworks.splitforge.core.ir.Expr.Select;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewriting walk over an IR tree.
 *
 * <p>Each {@code mutate*} method returns the original node when none of its
 * children changed, so untouched subtrees keep their identity and callers can
 * detect a no-op rewrite with {@code ==}.
 */
public abstract class IrMutator {

    public Stmt mutateStmt(Stmt stmt) {
        if (stmt instanceof LetStmt s) {
            return mutateLet(s);
        } else if (stmt instanceof AttrStmt s) {
            return mutateAttr(s);
        } else if (stmt instanceof ThreadExtent s) {
            return mutateThreadExtent(s);
        } else if (stmt instanceof For s) {
            return mutateFor(s);
        } else if (stmt instanceof IfThenElse s) {
            return mutateIfThenElse(s);
        } else if (stmt instanceof SeqStmt s) {
            return mutateSeq(s);
        } else if (stmt instanceof Allocate s) {
            return mutateAllocate(s);
        } else if (stmt instanceof Store s) {
            return mutateStore(s);
        } else if (stmt instanceof Evaluate s) {
            Expr value = mutateExpr(s.value());
            return value == s.value() ? s : new Evaluate(value);
        } else if (stmt instanceof AssertStmt s) {
            return mutateAssert(s);
        } else if (stmt instanceof LaunchKernel s) {
            return mutateLaunchKernel(s);
        }
        throw new IllegalStateException("Unhandled statement: " + stmt.getClass().getSimpleName());
    }

    public Expr mutateExpr(Expr expr) {
        if (expr instanceof Var v) {
            return mutateVar(v);
        } else if (expr instanceof Binary e) {
            Expr a = mutateExpr(e.a());
            Expr b = mutateExpr(e.b());
            return a == e.a() && b == e.b() ? e : new Binary(e.op(), a, b, e.dtype());
        } else if (expr instanceof Not e) {
            Expr a = mutateExpr(e.a());
            return a == e.a() ? e : new Not(a);
        } else if (expr instanceof Select e) {
            Expr c = mutateExpr(e.condition());
            Expr t = mutateExpr(e.trueValue());
            Expr f = mutateExpr(e.falseValue());
            return c == e.condition() && t == e.trueValue() && f == e.falseValue() ? e : new Select(c, t, f);
        } else if (expr instanceof Cast e) {
            Expr v = mutateExpr(e.value());
            return v == e.value() ? e : new Cast(e.dtype(), v);
        } else if (expr instanceof Load e) {
            Var buffer = mutateVarRef(e.buffer());
            Expr index = mutateExpr(e.index());
            return buffer == e.buffer() && index == e.index() ? e : new Load(e.dtype(), buffer, index);
        } else if (expr instanceof Call e) {
            List<Expr> args = mutateExprs(e.args());
            return args == e.args() ? e : new Call(e.dtype(), e.name(), args, e.kind());
        } else if (expr instanceof DescriptorGet e) {
            Var handle = mutateVarRef(e.handle());
            return handle == e.handle() ? e : new DescriptorGet(handle, e.field(), e.index());
        }
        return expr;
    }

    // ==================== Statements ====================

    protected Stmt mutateLet(LetStmt s) {
        Var var = mutateVarRef(s.var());
        Expr value = mutateExpr(s.value());
        Stmt body = mutateStmt(s.body());
        return var == s.var() && value == s.value() && body == s.body() ? s : new LetStmt(var, value, body);
    }

    protected Stmt mutateAttr(AttrStmt s) {
        Var node = s.node() == null ? null : mutateVarRef(s.node());
        Expr value = mutateExpr(s.value());
        Stmt body = mutateStmt(s.body());
        return node == s.node() && value == s.value() && body == s.body()
            ? s : new AttrStmt(s.key(), node, value, body);
    }

    protected Stmt mutateThreadExtent(ThreadExtent s) {
        Var var = mutateVarRef(s.iterVar().var());
        Expr extent = mutateExpr(s.extent());
        Stmt body = mutateStmt(s.body());
        if (var == s.iterVar().var() && extent == s.extent() && body == s.body()) {
            return s;
        }
        IterVar iv = var == s.iterVar().var() ? s.iterVar() : new IterVar(var, s.iterVar().threadTag());
        return new ThreadExtent(iv, extent, body);
    }

    protected Stmt mutateFor(For s) {
        Var loopVar = mutateVarRef(s.loopVar());
        Expr min = mutateExpr(s.min());
        Expr extent = mutateExpr(s.extent());
        Stmt body = mutateStmt(s.body());
        return loopVar == s.loopVar() && min == s.min() && extent == s.extent() && body == s.body()
            ? s : new For(loopVar, min, extent, s.kind(), body);
    }

    protected Stmt mutateIfThenElse(IfThenElse s) {
        Expr condition = mutateExpr(s.condition());
        Stmt thenCase = mutateStmt(s.thenCase());
        Stmt elseCase = s.elseCase() == null ? null : mutateStmt(s.elseCase());
        return condition == s.condition() && thenCase == s.thenCase() && elseCase == s.elseCase()
            ? s : new IfThenElse(condition, thenCase, elseCase);
    }

    protected Stmt mutateSeq(SeqStmt s) {
        List<Stmt> out = new ArrayList<>(s.stmts().size());
        boolean changed = false;
        for (Stmt stmt : s.stmts()) {
            Stmt m = mutateStmt(stmt);
            changed |= m != stmt;
            out.add(m);
        }
        return changed ? new SeqStmt(out) : s;
    }

    protected Stmt mutateAllocate(Allocate s) {
        Var buffer = mutateVarRef(s.buffer());
        List<Expr> extents = mutateExprs(s.extents());
        Stmt body = mutateStmt(s.body());
        return buffer == s.buffer() && extents == s.extents() && body == s.body()
            ? s : new Allocate(buffer, s.dtype(), extents, s.storageScope(), body);
    }

    protected Stmt mutateStore(Store s) {
        Var buffer = mutateVarRef(s.buffer());
        Expr value = mutateExpr(s.value());
        Expr index = mutateExpr(s.index());
        return buffer == s.buffer() && value == s.value() && index == s.index()
            ? s : new Store(buffer, value, index);
    }

    protected Stmt mutateAssert(AssertStmt s) {
        Expr condition = mutateExpr(s.condition());
        Expr expected = mutateExpr(s.expected());
        Expr actual = mutateExpr(s.actual());
        return condition == s.condition() && expected == s.expected() && actual == s.actual()
            ? s : new AssertStmt(condition, s.kind(), s.argName(), s.field(), expected, actual);
    }

    protected Stmt mutateLaunchKernel(LaunchKernel s) {
        List<Expr> args = mutateExprs(s.arguments());
        List<LaunchExtent> extents = new ArrayList<>();
        boolean changed = args != s.arguments();
        for (LaunchExtent e : s.launchExtents()) {
            Expr m = mutateExpr(e.extent());
            changed |= m != e.extent();
            extents.add(m == e.extent() ? e : new LaunchExtent(e.threadTag(), m));
        }
        return changed ? new LaunchKernel(s.kernelName(), args, extents) : s;
    }

    // ==================== Expressions ====================

    protected Expr mutateVar(Var v) {
        return v;
    }

    /**
     * Rewrite a variable in a position that must stay a variable (store target,
     * loop variable, descriptor handle). Defaults to {@link #mutateVar(Var)}.
     */
    protected Var mutateVarRef(Var v) {
        Expr e = mutateVar(v);
        if (!(e instanceof Var replacement)) {
            throw new IrInvariantException(
                "Variable '" + v.name() + "' in binding position rewritten to a non-variable expression");
        }
        return replacement;
    }

    protected final List<Expr> mutateExprs(List<Expr> exprs) {
        List<Expr> out = new ArrayList<>(exprs.size());
        boolean changed = false;
        for (Expr e : exprs) {
            Expr m = mutateExpr(e);
            changed |= m != e;
            out.add(m);
        }
        return changed ? out : exprs;
    }

    /**
     * Replace variables according to {@code mapping}, by identity.
     */
    public static Stmt substitute(Stmt stmt, Map<Var, ? extends Expr> mapping) {
        if (mapping.isEmpty()) {
            return stmt;
        }
        return new IrMutator() {
            @Override
            protected Expr mutateVar(Var v) {
                Expr replacement = mapping.get(v);
                return replacement == null ? v : replacement;
            }
        }.mutateStmt(stmt);
    }
}
