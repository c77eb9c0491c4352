package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;
import io.surfworks.splitforge.core.ir.Var;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Prints device kernels into one source file.
 *
 * <p>Each launch axis becomes a local variable initialised from the backend's
 * thread index. With launch diagnostics enabled, every thread extent is preceded
 * by a comment naming the axis and its extent; the comment does not affect the
 * compiled code.
 *
 * <pre>{@code
 * DeviceSourceGenerator gen = new DeviceSourceGenerator(BackendPolicies.CUDA, resolver, true);
 * for (PrimFunc kernel : split.deviceFunctions()) {
 *     gen.addFunction(kernel);
 * }
 * String cu = gen.source();
 * }</pre>
 */
public final class DeviceSourceGenerator extends SourceCodeGenerator {

    private static final Logger LOG = Logger.getLogger(DeviceSourceGenerator.class.getName());

    private final boolean launchDiagnostics;
    private final Set<Var> declaredAxes = new HashSet<>();
    private final List<KernelSource> kernels = new ArrayList<>();

    public DeviceSourceGenerator(BackendPolicy policy, TypeNameResolver types, boolean launchDiagnostics) {
        super(policy, types);
        this.launchDiagnostics = launchDiagnostics;
        printHeaders();
    }

    /**
     * Print {@code kernel} and append it to the file.
     *
     * @throws IllegalArgumentException if {@code kernel} is not a device function
     * @throws UnsupportedTypeException if a type used by the kernel has no spelling
     */
    public KernelSource addFunction(PrimFunc kernel) {
        if (kernel.kind() != PrimFunc.Kind.DEVICE) {
            throw new IllegalArgumentException(kernel.name() + " is not a device function");
        }
        int start = out.length();
        beginFunction(kernel.body());
        declaredAxes.clear();

        List<String> names = new ArrayList<>();
        List<String> typeTexts = new ArrayList<>();
        List<String> decls = new ArrayList<>();
        for (Var p : kernel.params()) {
            String decl;
            if (p.dtype().isHandle()) {
                decl = pointerParam(p);
            } else {
                decl = types.typeName(p.dtype()) + " " + nameOf(p);
            }
            decls.add(decl);
            names.add(nameOf(p));
            typeTexts.add(decl.substring(0, decl.length() - nameOf(p).length()).trim());
        }

        openBlock(policy.kernelQualifier() + " " + kernel.name() + "(" + String.join(", ", decls) + ")");
        printStmt(kernel.body());
        closeBlock();
        out.append('\n');

        KernelSource result = new KernelSource(kernel.name(), out.substring(start), names, typeTexts);
        kernels.add(result);
        LOG.fine(() -> "Generated " + policy.id() + " kernel " + kernel.name() + "(" + String.join(", ", names) + ")");
        return result;
    }

    public List<KernelSource> kernels() {
        return List.copyOf(kernels);
    }

    /**
     * The whole file: headers followed by every kernel added so far.
     */
    public String source() {
        return out.toString();
    }

    @Override
    protected void printThreadExtent(ThreadExtent s) {
        String tag = s.iterVar().threadTag();
        if (launchDiagnostics) {
            line("// thread_extent " + tag + " = " + printInert(s.extent()));
        }
        Var axis = s.iterVar().var();
        if (declaredAxes.add(axis)) {
            line(types.typeName(axis.dtype()) + " " + nameOf(axis) + " = " + policy.threadIndex(tag) + ";");
        }
        printStmt(s.body());
    }
}
