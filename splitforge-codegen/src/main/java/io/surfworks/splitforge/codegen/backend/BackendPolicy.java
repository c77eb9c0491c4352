package io.surfworks.splitforge.codegen.backend;

import java.util.List;
import java.util.Objects;

/**
 * Target-specific choices made while printing source.
 *
 * @param id                backend identifier, e.g. "cuda"
 * @param fileExtension     extension of generated device files, without the dot
 * @param headers           headers included at the top of every generated file
 * @param kernelQualifier   prefix of a kernel definition, e.g. {@code extern "C" __global__}
 * @param restrictKeyword   no-alias qualifier for pointer parameters, or empty
 * @param sharedQualifier   qualifier of block-shared allocations, or empty
 * @param castBufferAccess  print buffer accesses as {@code ((T*)buf)[i]} with untyped pointer parameters
 * @param threadIndexFormat format applied to a thread tag to read the current index
 * @param barrier           statement printed for the {@code sync_threads} intrinsic
 * @param halfType          spelling of float16
 * @param bfloatType        spelling of bfloat16
 * @param vectorTypes       whether short vector types such as {@code float4} exist
 */
public record BackendPolicy(
    String id,
    String fileExtension,
    List<String> headers,
    String kernelQualifier,
    String restrictKeyword,
    String sharedQualifier,
    boolean castBufferAccess,
    String threadIndexFormat,
    String barrier,
    String halfType,
    String bfloatType,
    boolean vectorTypes
) {
    public BackendPolicy {
        Objects.requireNonNull(id, "id cannot be null");
        headers = List.copyOf(headers);
    }

    /**
     * Expression reading the index along {@code threadTag}.
     */
    public String threadIndex(String threadTag) {
        return String.format(threadIndexFormat, threadTag);
    }

    public boolean hasRestrict() {
        return !restrictKeyword.isEmpty();
    }
}
