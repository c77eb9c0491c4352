package io.surfworks.splitforge.core.runtime;

import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Stmt.AttrStmt;
import io.surfworks.splitforge.core.ir.Stmt.Evaluate;
import io.surfworks.splitforge.core.ir.Stmt.For;
import io.surfworks.splitforge.core.ir.Stmt.IfThenElse;
import io.surfworks.splitforge.core.ir.Stmt.LaunchExtent;
import io.surfworks.splitforge.core.ir.Stmt.LaunchKernel;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.SeqStmt;
import io.surfworks.splitforge.core.ir.Var;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Executes a host function the way its generated source would, without a device.
 *
 * <p>Argument checks run exactly as emitted and raise {@link TypeMismatchException}
 * or {@link ShapeMismatchException}; kernel launches are recorded instead of
 * dispatched. Device memory is not modelled, so host bodies that allocate or store
 * are rejected.
 *
 * <p>Example:
 * <pre>{@code
 * List<KernelInvocation> launches = new EntryInterpreter(host)
 *     .run(Map.of(handleA, TensorDescriptor.of(DEVICE_CUDA, DataType.FLOAT32, 1024)));
 * }</pre>
 */
public final class EntryInterpreter {

    private static final Logger LOG = Logger.getLogger(EntryInterpreter.class.getName());

    private final PrimFunc function;

    public EntryInterpreter(PrimFunc function) {
        if (function.kind() == PrimFunc.Kind.DEVICE) {
            throw new IllegalArgumentException(function.name() + " is a device function");
        }
        this.function = function;
    }

    /**
     * Run the function.
     *
     * @param arguments value for every parameter: a {@link TensorDescriptor} for buffer
     *                  handles, a {@link Long} or {@link Double} for scalars
     * @return kernel launches in execution order
     * @throws ArgumentMismatchException when an argument check fails
     */
    public List<KernelInvocation> run(Map<Var, Object> arguments) {
        ExprEvaluator evaluator = new ExprEvaluator();
        for (Var param : function.params()) {
            if (!arguments.containsKey(param)) {
                throw new IllegalArgumentException("Missing argument for parameter " + param.name());
            }
            evaluator.bind(param, arguments.get(param));
        }
        List<KernelInvocation> launches = new ArrayList<>();
        execute(function.body(), evaluator, launches);
        LOG.fine(function.name() + " completed with " + launches.size() + " kernel launch(es)");
        return launches;
    }

    private void execute(Stmt stmt, ExprEvaluator ev, List<KernelInvocation> launches) {
        if (stmt instanceof SeqStmt s) {
            for (Stmt child : s.stmts()) {
                execute(child, ev, launches);
            }
        } else if (stmt instanceof AssertStmt s) {
            check(s, ev);
        } else if (stmt instanceof LetStmt s) {
            ev.bind(s.var(), ev.evaluate(s.value()));
            execute(s.body(), ev, launches);
            ev.unbind(s.var());
        } else if (stmt instanceof For s) {
            long min = ev.evaluateLong(s.min());
            long extent = ev.evaluateLong(s.extent());
            for (long i = min; i < min + extent; i++) {
                ev.bind(s.loopVar(), i);
                execute(s.body(), ev, launches);
            }
            ev.unbind(s.loopVar());
        } else if (stmt instanceof IfThenElse s) {
            if (ev.evaluateBool(s.condition())) {
                execute(s.thenCase(), ev, launches);
            } else if (s.elseCase() != null) {
                execute(s.elseCase(), ev, launches);
            }
        } else if (stmt instanceof AttrStmt s) {
            if (AttrStmt.DEVICE_SCOPE.equals(s.key())) {
                throw new IllegalStateException("Device region in " + function.name() + " has not been split");
            }
            execute(s.body(), ev, launches);
        } else if (stmt instanceof LaunchKernel s) {
            launches.add(launch(s, ev));
        } else if (stmt instanceof Evaluate s) {
            ev.evaluate(s.value());
        } else if (stmt instanceof Stmt.ThreadExtent) {
            throw new IllegalStateException("Device region in " + function.name() + " has not been split");
        } else {
            throw new UnsupportedOperationException(
                "Host interpreter does not model " + stmt.getClass().getSimpleName());
        }
    }

    private static void check(AssertStmt s, ExprEvaluator ev) {
        if (ev.evaluateBool(s.condition())) {
            return;
        }
        Object expected = ev.evaluate(s.expected());
        Object actual = ev.evaluate(s.actual());
        throw switch (s.kind()) {
            case TYPE -> new TypeMismatchException(s.argName(), s.field(), expected, actual);
            case SHAPE -> new ShapeMismatchException(s.argName(), s.field(), expected, actual);
        };
    }

    private static KernelInvocation launch(LaunchKernel s, ExprEvaluator ev) {
        List<Object> args = new ArrayList<>();
        for (Expr arg : s.arguments()) {
            args.add(ev.evaluate(arg));
        }
        Map<String, Long> dims = new LinkedHashMap<>();
        for (LaunchExtent extent : s.launchExtents()) {
            dims.put(extent.threadTag(), ev.evaluateLong(extent.extent()));
        }
        return new KernelInvocation(s.kernelName(), args, dims);
    }
}
