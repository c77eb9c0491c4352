package io.surfworks.splitforge.codegen.backend;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Built-in backend policies, looked up by identifier.
 */
public final class BackendPolicies {

    public static final BackendPolicy CUDA = new BackendPolicy(
        "cuda", "cu",
        List.of("cuda_fp16.h", "cuda_bf16.h", "stdint.h"),
        "extern \"C\" __global__ void", "__restrict__", "__shared__",
        true, "%s", "__syncthreads();", "half", "nv_bfloat16", true);

    public static final BackendPolicy HIP = new BackendPolicy(
        "hip", "hip",
        List.of("hip/hip_runtime.h", "hip/hip_fp16.h", "hip/hip_bfloat16.h"),
        "extern \"C\" __global__ void", "__restrict__", "__shared__",
        true, "%s", "__syncthreads();", "half", "hip_bfloat16", true);

    /** Plain C. Launch indices come from the runtime; there is no shared memory. */
    public static final BackendPolicy C = new BackendPolicy(
        "c", "c",
        List.of("stdint.h", "stdbool.h", "stddef.h", "splitforge_runtime.h"),
        "void", "restrict", "",
        false, "splitforge_thread_index(\"%s\")", "splitforge_barrier();", "_Float16", "__bf16", false);

    private static final Map<String, BackendPolicy> POLICIES = Map.of(
        CUDA.id(), CUDA,
        HIP.id(), HIP,
        C.id(), C);

    private BackendPolicies() {} // Utility class

    /**
     * Get the policy for a backend identifier (case-insensitive).
     *
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static BackendPolicy forId(String id) {
        BackendPolicy policy = POLICIES.get(id.toLowerCase(Locale.ROOT));
        if (policy == null) {
            throw new IllegalArgumentException(
                "Backend '" + id + "' not supported. Available: " + available());
        }
        return policy;
    }

    public static boolean isSupported(String id) {
        return POLICIES.containsKey(id.toLowerCase(Locale.ROOT));
    }

    public static List<String> available() {
        return List.copyOf(new TreeMap<>(POLICIES).keySet());
    }
}
