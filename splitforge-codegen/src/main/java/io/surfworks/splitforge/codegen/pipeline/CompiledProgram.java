package io.surfworks.splitforge.codegen.pipeline;

import io.surfworks.splitforge.codegen.KernelManifest;
import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.ir.PrimFunc;

import java.util.List;

/**
 * Result of compiling one function.
 *
 * @param name            source function name
 * @param hostFunction    bound and split host function
 * @param deviceFunctions extracted kernels
 * @param hostSource      host entry source file
 * @param deviceSource    device source file (headers only when there are no kernels)
 * @param manifest        kernel binary interface
 * @param target          device backend
 * @param hostTarget      host backend
 */
public record CompiledProgram(
    String name,
    PrimFunc hostFunction,
    List<PrimFunc> deviceFunctions,
    String hostSource,
    String deviceSource,
    KernelManifest manifest,
    BackendPolicy target,
    BackendPolicy hostTarget
) {
    public CompiledProgram {
        deviceFunctions = List.copyOf(deviceFunctions);
    }
}
