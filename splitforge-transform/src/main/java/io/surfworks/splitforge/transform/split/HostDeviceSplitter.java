package io.surfworks.splitforge.transform.split;

import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.IrInvariantException;
import io.surfworks.splitforge.core.ir.IrMutator;
import io.surfworks.splitforge.core.ir.IrVisitor;
import io.surfworks.splitforge.core.ir.IterVar;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt;
import io.surfworks.splitforge.core.ir.Stmt.Allocate;
import io.surfworks.splitforge.core.ir.Stmt.AttrStmt;
import io.surfworks.splitforge.core.ir.Stmt.For;
import io.surfworks.splitforge.core.ir.Stmt.LaunchExtent;
import io.surfworks.splitforge.core.ir.Stmt.LaunchKernel;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;
import io.surfworks.splitforge.core.ir.Var;
import io.surfworks.splitforge.transform.analysis.UseDefAnalyzer;
import io.surfworks.splitforge.transform.analysis.UseDefRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Splits a function into a host function and device kernels.
 *
 * <p>Every outermost {@link ThreadExtent} or {@code device_scope} {@link AttrStmt}
 * starts a device region. Each region becomes a kernel named
 * {@code <function>_kernel<N>} whose parameters are the region's captured
 * variables in {@link CaptureOrdering} order; the region is replaced in the host
 * function by a {@link LaunchKernel} passing the same variables in the same order,
 * followed by the launch extents.
 *
 * <p>Handle parameters are rebuilt as fresh variables inside the kernel, so host
 * and device never share a pointer variable.
 *
 * <p>Example:
 * <pre>{@code
 * SplitResult result = new HostDeviceSplitter().split(function);
 * PrimFunc host = result.hostFunction();
 * for (PrimFunc kernel : result.deviceFunctions()) {
 *     System.out.println(kernel.name() + " " + kernel.params());
 * }
 * }</pre>
 */
public final class HostDeviceSplitter {

    private static final Logger LOG = Logger.getLogger(HostDeviceSplitter.class.getName());

    /**
     * Split {@code function}. A function without device regions, or one that is
     * already a device function, is returned as-is with no kernels.
     */
    public SplitResult split(PrimFunc function) {
        if (function.kind() == PrimFunc.Kind.DEVICE) {
            return new SplitResult(function, List.of());
        }
        RegionExtractor extractor = new RegionExtractor(function);
        Stmt body = extractor.mutateStmt(function.body());
        if (extractor.kernels.isEmpty()) {
            LOG.fine(function.name() + " has no device regions");
            return new SplitResult(function, List.of());
        }
        PrimFunc host = function.withBody(body).withKind(PrimFunc.Kind.HOST);
        LOG.fine("Split " + function.name() + " into " + extractor.kernels.size() + " kernel(s)");
        return new SplitResult(host, extractor.kernels);
    }

    /**
     * Walks the host function, tracking which variables are in scope, and replaces
     * device regions with launches.
     */
    private static final class RegionExtractor extends IrMutator {

        private final PrimFunc function;
        private final Set<Var> visible;
        private final List<PrimFunc> kernels = new ArrayList<>();

        RegionExtractor(PrimFunc function) {
            this.function = function;
            this.visible = new HashSet<>(function.entryScope());
        }

        @Override
        protected Stmt mutateThreadExtent(ThreadExtent s) {
            return extract(s);
        }

        @Override
        protected Stmt mutateAttr(AttrStmt s) {
            if (AttrStmt.DEVICE_SCOPE.equals(s.key())) {
                return extract(s.body());
            }
            return super.mutateAttr(s);
        }

        @Override
        protected Stmt mutateLet(LetStmt s) {
            return scoped(s.var(), () -> super.mutateLet(s));
        }

        @Override
        protected Stmt mutateFor(For s) {
            return scoped(s.loopVar(), () -> super.mutateFor(s));
        }

        @Override
        protected Stmt mutateAllocate(Allocate s) {
            return scoped(s.buffer(), () -> super.mutateAllocate(s));
        }

        private Stmt scoped(Var var, java.util.function.Supplier<Stmt> body) {
            boolean added = visible.add(var);
            try {
                return body.get();
            } finally {
                if (added) {
                    visible.remove(var);
                }
            }
        }

        private Stmt extract(Stmt region) {
            String kernelName = function.name() + "_kernel" + kernels.size();

            UseDefRecord record = new UseDefAnalyzer(false).analyze(region);
            List<Var> captures = CaptureOrdering.order(record);
            for (Var v : captures) {
                if (!visible.contains(v)) {
                    throw IrInvariantException.unresolvedCapture(v, kernelName);
                }
            }

            Map<Var, Var> rebuilt = new LinkedHashMap<>();
            List<Var> params = new ArrayList<>(captures.size());
            for (Var v : captures) {
                if (v.dtype().isHandle()) {
                    Var local = v.copy();
                    rebuilt.put(v, local);
                    params.add(local);
                } else {
                    params.add(v);
                }
            }
            Stmt kernelBody = IrMutator.substitute(region, rebuilt);

            List<IterVar> axes = record.threadAxes();
            List<LaunchExtent> extents = new ArrayList<>(axes.size());
            for (int i = 0; i < axes.size(); i++) {
                Expr extent = record.launchExtents().get(i);
                requireHostVisible(extent, kernelName);
                extents.add(new LaunchExtent(axes.get(i).threadTag(), extent));
            }

            kernels.add(new PrimFunc(kernelName, params, Map.of(), kernelBody, PrimFunc.Kind.DEVICE, axes));
            LOG.fine(() -> "Extracted " + kernelName + " with parameters " + captures
                + " and launch axes " + axes.stream().map(IterVar::threadTag).toList());

            return new LaunchKernel(kernelName, new ArrayList<Expr>(captures), extents);
        }

        private void requireHostVisible(Expr extent, String kernelName) {
            new IrVisitor() {
                @Override
                protected void visitVar(Var v) {
                    if (!visible.contains(v)) {
                        throw new IrInvariantException("Launch extent of " + kernelName
                            + " depends on '" + v.name() + "', which is not available on the host");
                    }
                }
            }.visitExpr(extent);
        }
    }
}
