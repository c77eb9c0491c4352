package io.surfworks.splitforge.codegen.pipeline;

import io.surfworks.splitforge.codegen.CodegenException;
import io.surfworks.splitforge.codegen.DeviceSourceGenerator;
import io.surfworks.splitforge.codegen.HostSourceGenerator;
import io.surfworks.splitforge.codegen.KernelManifest;
import io.surfworks.splitforge.codegen.TypeNameResolver;
import io.surfworks.splitforge.codegen.backend.BackendPolicies;
import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.config.CompilerConfig;
import io.surfworks.splitforge.core.dtype.DatatypeRegistry;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.transform.binder.ArgumentBinder;
import io.surfworks.splitforge.transform.split.HostDeviceSplitter;
import io.surfworks.splitforge.transform.split.SplitResult;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Binds, splits and prints a function.
 *
 * <p>A pipeline holds no per-compilation state and may be shared between threads;
 * the only shared mutable object is the datatype registry, which is thread-safe.
 *
 * <pre>{@code
 * CompilationPipeline pipeline = new CompilationPipeline(CompilerConfigLoader.load(), registry);
 * CompiledProgram program = pipeline.compile(function);
 * System.out.println(program.manifest().toJson());
 * }</pre>
 */
public final class CompilationPipeline {

    private static final Logger LOG = Logger.getLogger(CompilationPipeline.class.getName());

    private final CompilerConfig config;
    private final DatatypeRegistry registry;
    private final BackendPolicy target;
    private final BackendPolicy hostTarget;

    /**
     * @throws IllegalArgumentException if either configured backend is unknown
     */
    public CompilationPipeline(CompilerConfig config, DatatypeRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.target = BackendPolicies.forId(config.target());
        this.hostTarget = BackendPolicies.forId(config.hostTarget());
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compile {@code function} in memory.
     */
    public CompiledProgram compile(PrimFunc function) {
        PrimFunc bound = ArgumentBinder.bindFunction(function);
        SplitResult split = new HostDeviceSplitter().split(bound);

        DeviceSourceGenerator device = new DeviceSourceGenerator(
            target, new TypeNameResolver(target, registry), config.emitLaunchDiagnostics());
        for (PrimFunc kernel : split.deviceFunctions()) {
            device.addFunction(kernel);
        }
        String hostSource = new HostSourceGenerator(hostTarget, new TypeNameResolver(hostTarget, registry))
            .generate(split.hostFunction());

        KernelManifest manifest = KernelManifest.of(
            function.name(), target.id(), split.deviceFunctions(), device.kernels());

        LOG.info("Compiled " + function.name() + ": " + split.deviceFunctions().size()
            + " kernel(s) for " + target.id() + ", host " + hostTarget.id());
        return new CompiledProgram(function.name(), split.hostFunction(), split.deviceFunctions(),
            hostSource, device.source(), manifest, target, hostTarget);
    }

    /**
     * Compile {@code function} and write its sources to the configured output directory.
     *
     * @throws IllegalStateException if no output directory is configured
     * @throws CodegenException      if writing fails
     */
    public List<Path> compileAndWrite(PrimFunc function) throws CodegenException {
        if (config.outputDir() == null) {
            throw new IllegalStateException("No output directory configured");
        }
        CompiledProgram program = compile(function);
        List<Path> written = KernelSourceWriter.write(program, config.outputDir());
        LOG.info("Wrote " + written.size() + " file(s) for " + function.name() + " to " + config.outputDir());
        return written;
    }
}
