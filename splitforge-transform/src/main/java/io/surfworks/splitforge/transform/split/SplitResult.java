package io.surfworks.splitforge.transform.split;

import io.surfworks.splitforge.core.ir.PrimFunc;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link HostDeviceSplitter}.
 *
 * @param hostFunction    the original function with each device region replaced by a launch
 * @param deviceFunctions extracted kernels, in the order their launches appear
 */
public record SplitResult(PrimFunc hostFunction, List<PrimFunc> deviceFunctions) {

    public SplitResult {
        deviceFunctions = List.copyOf(deviceFunctions);
    }

    public boolean hasDeviceCode() {
        return !deviceFunctions.isEmpty();
    }

    public Optional<PrimFunc> deviceFunction(String name) {
        return deviceFunctions.stream()
            .filter(f -> f.name().equals(name))
            .findFirst();
    }
}
