package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.codegen.KernelManifest.Kernel;
import io.surfworks.splitforge.codegen.KernelManifest.Parameter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KernelManifestTest {

    private static KernelManifest sample() {
        return new KernelManifest("vadd", "cuda", List.of(
            new Kernel("vadd_kernel0", List.of(
                new Parameter("A", "void* __restrict__", "float32", true),
                new Parameter("n", "int", "int32", false)),
                List.of("blockIdx.x", "threadIdx.x"))));
    }

    @Test
    void jsonRoundTrip() {
        KernelManifest manifest = sample();
        assertEquals(manifest, KernelManifest.fromJson(manifest.toJson()));
    }

    @Test
    void jsonKeepsQuotesAndAngleBracketsReadable() {
        KernelManifest manifest = new KernelManifest("f", "cuda", List.of(
            new Kernel("f_kernel0", List.of(new Parameter("p", "Vec<float>&", "handle", true)), List.of())));

        String json = manifest.toJson();

        assertTrue(json.contains("\"Vec<float>&\""), json);
    }

    @Test
    void jsonFieldOrderIsStable() {
        String json = sample().toJson();

        assertTrue(json.indexOf("\"function\"") < json.indexOf("\"target\""));
        assertTrue(json.indexOf("\"target\"") < json.indexOf("\"kernels\""));
        assertTrue(json.indexOf("\"parameters\"") < json.indexOf("\"launchAxes\""));
        assertEquals(json, sample().toJson());
    }

    @Test
    void missingKernelListReadsAsEmpty() {
        KernelManifest manifest = KernelManifest.fromJson("{\"function\": \"f\", \"target\": \"c\"}");
        assertTrue(manifest.kernels().isEmpty());
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> KernelManifest.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> KernelManifest.fromJson("{\"target\": \"c\"}"));
        assertThrows(IllegalArgumentException.class, () -> KernelManifest.fromJson(""));
    }
}
