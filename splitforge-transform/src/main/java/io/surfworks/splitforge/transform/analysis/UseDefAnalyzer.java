package io.surfworks.splitforge.transform.analysis;

import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.IrInvariantException;
import io.surfworks.splitforge.core.ir.IrVisitor;
import io.surfworks.splitforge.core.ir.IterVar;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt;
import io.surfworks.splitforge.core.ir.Stmt.Allocate;
import io.surfworks.splitforge.core.ir.Stmt.AttrStmt;
import io.surfworks.splitforge.core.ir.Stmt.For;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.Store;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;
import io.surfworks.splitforge.core.ir.Var;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-pass use/definition analysis over a statement tree.
 *
 * <p>Rules:
 * <ul>
 *   <li>every variable reference counts as a use;</li>
 *   <li>a {@link Store} also marks its buffer as an output hint;</li>
 *   <li>{@link LetStmt}, {@link For} and {@link Allocate} define their variable;</li>
 *   <li>the first {@link ThreadExtent} for a launch axis defines the axis variable and
 *       records the axis with its extent;</li>
 *   <li>a use of a variable with no prior definition in the scope lands in
 *       {@link UseDefRecord#undefined()}.</li>
 * </ul>
 *
 * <p>Launch extents are host-side values. When {@code visitLaunchExtents} is false
 * (the setting used for kernel extraction) their expressions are not walked, so a
 * variable that only bounds a launch axis is not captured.
 *
 * <p>The IR is only read. An analyzer instance is single-use.
 *
 * <p>Example:
 * <pre>{@code
 * UseDefRecord record = new UseDefAnalyzer(false).analyze(region);
 * Set<Var> captures = record.undefined();
 * }</pre>
 */
public final class UseDefAnalyzer extends IrVisitor {

    private final boolean visitLaunchExtents;
    private final Map<Var, Integer> useCounts = new LinkedHashMap<>();
    private final Map<Var, Integer> defCounts = new LinkedHashMap<>();
    private final Set<Var> outputHints = new LinkedHashSet<>();
    private final Set<Var> undefined = new LinkedHashSet<>();
    private final List<IterVar> threadAxes = new ArrayList<>();
    private final List<Expr> launchExtents = new ArrayList<>();
    private final Set<Var> rebindable = new HashSet<>();
    private boolean used;

    public UseDefAnalyzer(boolean visitLaunchExtents) {
        this.visitLaunchExtents = visitLaunchExtents;
    }

    /**
     * Analyze a free-standing region: nothing is defined on entry.
     */
    public UseDefRecord analyze(Stmt region) {
        claim();
        visitStmt(region);
        return snapshot();
    }

    /**
     * Analyze a whole function: parameters, buffer data pointers and symbolic
     * shape/stride variables are defined on entry. Data pointers and symbolic
     * variables may additionally be bound once in the body, as the argument
     * binder does.
     */
    public UseDefRecord analyzeFunction(PrimFunc function) {
        claim();
        for (Var v : function.entryScope()) {
            handleDef(v);
            if (!function.params().contains(v)) {
                rebindable.add(v);
            }
        }
        visitStmt(function.body());
        return snapshot();
    }

    private void claim() {
        if (used) {
            throw new IllegalStateException("UseDefAnalyzer instances are single-use");
        }
        used = true;
    }

    private UseDefRecord snapshot() {
        return new UseDefRecord(useCounts, defCounts, outputHints, undefined, threadAxes, launchExtents);
    }

    // ==================== Definitions ====================

    @Override
    protected void visitLet(LetStmt s) {
        visitExpr(s.value());
        handleDef(s.var());
        visitStmt(s.body());
    }

    @Override
    protected void visitFor(For s) {
        handleDef(s.loopVar());
        visitExpr(s.min());
        visitExpr(s.extent());
        visitStmt(s.body());
    }

    @Override
    protected void visitAllocate(Allocate s) {
        handleDef(s.buffer());
        for (Expr extent : s.extents()) {
            visitExpr(extent);
        }
        visitStmt(s.body());
    }

    @Override
    protected void visitThreadExtent(ThreadExtent s) {
        IterVar iv = s.iterVar();
        // a launch axis may be annotated more than once; the first annotation defines it
        if (!useCounts.containsKey(iv.var())) {
            handleDef(iv.var());
            threadAxes.add(iv);
            launchExtents.add(s.extent());
        }
        if (visitLaunchExtents) {
            visitExpr(s.extent());
        }
        visitStmt(s.body());
    }

    @Override
    protected void visitAttr(AttrStmt s) {
        if (s.node() != null) {
            handleUse(s.node());
        }
        visitExpr(s.value());
        visitStmt(s.body());
    }

    // ==================== Uses ====================

    @Override
    protected void visitStore(Store s) {
        handleUse(s.buffer());
        outputHints.add(s.buffer());
        visitExpr(s.value());
        visitExpr(s.index());
    }

    @Override
    protected void visitVar(Var v) {
        handleUse(v);
    }

    private void handleDef(Var v) {
        if (rebindable.remove(v)) {
            return;
        }
        if (defCounts.containsKey(v)) {
            throw IrInvariantException.redefined(v);
        }
        if (useCounts.containsKey(v)) {
            throw IrInvariantException.usedBeforeDefinition(v);
        }
        useCounts.put(v, 0);
        defCounts.put(v, 1);
    }

    private void handleUse(Var v) {
        Integer count = useCounts.get(v);
        if (count == null) {
            undefined.add(v);
            useCounts.put(v, 1);
        } else {
            useCounts.put(v, count + 1);
        }
    }
}
