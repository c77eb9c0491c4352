package io.surfworks.splitforge.core.runtime;

import java.util.List;
import java.util.Map;

/**
 * A kernel launch observed while interpreting a host function.
 *
 * @param kernelName device function name
 * @param arguments  evaluated arguments in parameter order
 * @param launch     thread tag to evaluated extent, in launch order
 */
public record KernelInvocation(String kernelName, List<Object> arguments, Map<String, Long> launch) {
}
