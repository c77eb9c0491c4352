package io.surfworks.splitforge.codegen;

import java.util.List;

/**
 * Printed form of one kernel.
 *
 * @param name           kernel symbol
 * @param source         the kernel definition, without file headers
 * @param parameterNames parameter names as printed, in ABI order
 * @param parameterTypes parameter type text, parallel to {@code parameterNames}
 */
public record KernelSource(String name, String source, List<String> parameterNames, List<String> parameterTypes) {

    public KernelSource {
        parameterNames = List.copyOf(parameterNames);
        parameterTypes = List.copyOf(parameterTypes);
        if (parameterNames.size() != parameterTypes.size()) {
            throw new IllegalArgumentException("Parameter names and types differ in length for " + name);
        }
    }
}
