package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Stmt.LaunchExtent;
import io.surfworks.splitforge.core.ir.Stmt.LaunchKernel;
import io.surfworks.splitforge.core.ir.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Prints the host entry function.
 *
 * <p>The entry function returns 0 on success. A failed argument check reports the
 * mismatch to the runtime and returns -1; so does a failed kernel launch.
 */
public final class HostSourceGenerator extends SourceCodeGenerator {

    private static final Logger LOG = Logger.getLogger(HostSourceGenerator.class.getName());

    /** Runtime struct behind every tensor argument. */
    public static final String DESCRIPTOR_TYPE = "SFTensorDescriptor";

    public HostSourceGenerator(BackendPolicy policy, TypeNameResolver types) {
        super(policy, types);
    }

    /**
     * Print {@code function} as a complete source file.
     *
     * @throws IllegalArgumentException if {@code function} is a device function
     */
    public String generate(PrimFunc function) {
        if (function.kind() == PrimFunc.Kind.DEVICE) {
            throw new IllegalArgumentException(function.name() + " is a device function");
        }
        out.setLength(0);
        printHeaders();
        beginFunction(function.body());

        List<String> decls = new ArrayList<>();
        for (Var p : function.params()) {
            if (function.bufferMap().containsKey(p)) {
                decls.add(DESCRIPTOR_TYPE + "* " + nameOf(p));
            } else if (p.dtype().isHandle()) {
                decls.add("void* " + nameOf(p));
            } else {
                decls.add(types.typeName(p.dtype()) + " " + nameOf(p));
            }
        }
        openBlock("int32_t " + function.name() + "(" + String.join(", ", decls) + ")");
        printStmt(function.body());
        line("return 0;");
        closeBlock();

        LOG.fine(() -> "Generated host entry " + function.name() + " for " + policy.id());
        return out.toString();
    }

    @Override
    protected void printAssert(AssertStmt s) {
        openBlock("if (!" + printExpr(s.condition()) + ")");
        line("splitforge_report_mismatch(\"" + s.kind().name().toLowerCase(Locale.ROOT) + "\", \"" + s.argName()
            + "\", \"" + s.field() + "\", (int64_t)" + printExpr(s.expected())
            + ", (int64_t)" + printExpr(s.actual()) + ");");
        line("return -1;");
        closeBlock();
    }

    @Override
    protected void printLaunch(LaunchKernel s) {
        openBlock("");
        String args = "NULL";
        if (!s.arguments().isEmpty()) {
            List<String> refs = new ArrayList<>();
            for (Expr arg : s.arguments()) {
                if (!(arg instanceof Var v)) {
                    throw new IllegalStateException("Launch argument of " + s.kernelName() + " is not a variable: " + arg);
                }
                refs.add("(void*)&" + nameOf(v));
            }
            line("void* args[] = {" + String.join(", ", refs) + "};");
            args = "args";
        }
        String tags = "NULL";
        String extents = "NULL";
        if (!s.launchExtents().isEmpty()) {
            List<String> tagText = new ArrayList<>();
            List<String> extentText = new ArrayList<>();
            for (LaunchExtent e : s.launchExtents()) {
                tagText.add("\"" + e.threadTag() + "\"");
                extentText.add("(int64_t)" + printExpr(e.extent()));
            }
            line("const char* tags[] = {" + String.join(", ", tagText) + "};");
            line("int64_t extents[] = {" + String.join(", ", extentText) + "};");
            tags = "tags";
            extents = "extents";
        }
        openBlock("if (splitforge_launch_kernel(\"" + s.kernelName() + "\", " + args + ", "
            + s.arguments().size() + ", " + tags + ", " + extents + ", " + s.launchExtents().size() + ") != 0)");
        line("return -1;");
        closeBlock();
        closeBlock();
    }
}
