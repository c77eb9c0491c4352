package io.surfworks.splitforge.codegen;

import io.surfworks.splitforge.codegen.backend.BackendPolicies;
import io.surfworks.splitforge.codegen.backend.BackendPolicy;
import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.dtype.DatatypeRegistry;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.Expr.Cast;
import io.surfworks.splitforge.core.ir.IterVar;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.Store;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;
import io.surfworks.splitforge.core.ir.Var;
import io.surfworks.splitforge.transform.split.HostDeviceSplitter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DeviceSourceGenerator")
class DeviceSourceGeneratorTest {

    private final DatatypeRegistry registry = new DatatypeRegistry();

    private DeviceSourceGenerator generator(BackendPolicy policy, boolean diagnostics) {
        return new DeviceSourceGenerator(policy, new TypeNameResolver(policy, registry), diagnostics);
    }

    private static String stripComments(String source) {
        return source.lines()
            .filter(l -> !l.trim().startsWith("// thread_extent"))
            .map(l -> l + "\n")
            .reduce("", String::concat);
    }

    private static PrimFunc kernelOf(PrimFunc function) {
        return new HostDeviceSplitter().split(function).deviceFunctions().get(0);
    }

    @Nested
    @DisplayName("CUDA")
    class Cuda {

        @Test
        void signatureUsesUntypedRestrictPointers() {
            DeviceSourceGenerator gen = generator(BackendPolicies.CUDA, true);
            KernelSource source = gen.addFunction(kernelOf(CodegenFixtures.vectorAdd(DataType.FLOAT32)));

            assertTrue(source.source().contains("extern \"C\" __global__ void vadd_kernel0("
                + "void* __restrict__ A, void* __restrict__ B, int n, void* __restrict__ C) {"), source.source());
            assertEquals(List.of("A", "B", "n", "C"), source.parameterNames());
            assertEquals(List.of("void* __restrict__", "void* __restrict__", "int", "void* __restrict__"),
                source.parameterTypes());
        }

        @Test
        void bufferAccessesAreCastWrapped() {
            DeviceSourceGenerator gen = generator(BackendPolicies.CUDA, true);
            String src = gen.addFunction(kernelOf(CodegenFixtures.vectorAdd(DataType.FLOAT32))).source();

            assertTrue(src.contains("((float*)C)[i] = (((float*)A)[i] + ((float*)B)[i]);"), src);
            assertTrue(src.contains("int bx = blockIdx.x;"), src);
            assertTrue(src.contains("int tx = threadIdx.x;"), src);
        }

        @Test
        void launchDiagnosticsAreComments() {
            String with = generator(BackendPolicies.CUDA, true)
                .addFunction(kernelOf(CodegenFixtures.vectorAdd(DataType.FLOAT32))).source();
            String without = generator(BackendPolicies.CUDA, false)
                .addFunction(kernelOf(CodegenFixtures.vectorAdd(DataType.FLOAT32))).source();

            assertTrue(with.contains("// thread_extent blockIdx.x = ((n + 63) / 64)"), with);
            assertTrue(with.contains("// thread_extent threadIdx.x = 64"), with);
            assertFalse(without.contains("thread_extent"), without);
            assertEquals(without, stripComments(with));
        }

        @Test
        void diagnosticsDoNotClaimNames() {
            Var hostN = Var.int32("n");
            Var localN = Var.int32("n");
            Var out = Var.pointer("out", DataType.FLOAT32);
            IterVar tx = IterVar.threadIdx("x", "tx");
            PrimFunc kernel = new PrimFunc("shadow", List.of(out), Map.of(),
                new ThreadExtent(tx, hostN,
                    new LetStmt(localN, Expr.constant(1),
                        new Store(out, new Cast(DataType.FLOAT32, localN), tx.var()))),
                PrimFunc.Kind.DEVICE, List.of(tx));

            String with = generator(BackendPolicies.CUDA, true).addFunction(kernel).source();
            String without = generator(BackendPolicies.CUDA, false).addFunction(kernel).source();

            assertTrue(with.contains("// thread_extent threadIdx.x = n"), with);
            assertTrue(with.contains("int n = 1;"), with);
            assertTrue(with.contains("((float*)out)[tx] = ((float)n);"), with);
            assertEquals(without, stripComments(with));
        }

        @Test
        void sharedMemoryBarrierAndVolatile() {
            String src = generator(BackendPolicies.CUDA, false)
                .addFunction(kernelOf(CodegenFixtures.reverseInShared())).source();

            assertTrue(src.contains("__shared__ float scratch[128];"), src);
            assertTrue(src.contains("scratch[tx] = ((float*)in)[tx];"), src);
            assertTrue(src.contains("__syncthreads();"), src);
            assertTrue(src.contains("((volatile float*)out)[tx] = scratch[(127 - tx)];"), src);
        }

        @Test
        void customTypesUseRegisteredNames() {
            int code = registry.register("posit16_t");
            String src = generator(BackendPolicies.CUDA, false)
                .addFunction(kernelOf(CodegenFixtures.vectorAdd(new DataType.Custom(code, 16, 1)))).source();

            assertTrue(src.contains("((posit16_t*)C)[i]"), src);
        }

        @Test
        void unregisteredCustomTypeFails() {
            DeviceSourceGenerator gen = generator(BackendPolicies.CUDA, false);
            PrimFunc kernel = kernelOf(CodegenFixtures.vectorAdd(new DataType.Custom(200, 16, 1)));
            assertThrows(UnsupportedTypeException.class, () -> gen.addFunction(kernel));
        }
    }

    @Nested
    @DisplayName("Plain C")
    class PlainC {

        @Test
        void typedPointersAndRuntimeThreadIndex() {
            String src = generator(BackendPolicies.C, false)
                .addFunction(kernelOf(CodegenFixtures.vectorAdd(DataType.FLOAT32))).source();

            assertTrue(src.contains("void vadd_kernel0(float* restrict A, float* restrict B, int n, float* restrict C) {"), src);
            assertTrue(src.contains("C[i] = (A[i] + B[i]);"), src);
            assertTrue(src.contains("int bx = splitforge_thread_index(\"blockIdx.x\");"), src);
            assertTrue(src.startsWith("#include <stdint.h>"), src);
        }

        @Test
        void volatileParameterDeclaration() {
            String src = generator(BackendPolicies.C, false)
                .addFunction(kernelOf(CodegenFixtures.reverseInShared())).source();

            assertTrue(src.contains("volatile float* restrict out"), src);
            assertTrue(src.contains("float scratch[128];"), src);
            assertFalse(src.contains("__shared__"), src);
        }
    }

    @Nested
    @DisplayName("Naming")
    class Naming {

        @Test
        void clashingNamesAreSuffixed() {
            Var x1 = Var.int32("x");
            Var x2 = Var.int32("x");
            Var out = Var.pointer("out", DataType.INT32);
            PrimFunc kernel = new PrimFunc("clash", List.of(x1, x2, out), Map.of(),
                new Store(out, Expr.add(x1, x2), Expr.constant(0)), PrimFunc.Kind.DEVICE, List.of());

            KernelSource source = generator(BackendPolicies.CUDA, false).addFunction(kernel);

            assertEquals(List.of("x", "x_1", "out"), source.parameterNames());
            assertTrue(source.source().contains("((int*)out)[0] = (x + x_1);"), source.source());
        }

        @Test
        void kernelsShareOneFile() {
            DeviceSourceGenerator gen = generator(BackendPolicies.HIP, false);
            gen.addFunction(kernelOf(CodegenFixtures.vectorAdd(DataType.FLOAT32)));
            gen.addFunction(kernelOf(CodegenFixtures.reverseInShared()));

            String src = gen.source();
            assertTrue(src.startsWith("#include <hip/hip_runtime.h>"), src);
            assertTrue(src.indexOf("vadd_kernel0") < src.indexOf("reverse_kernel0"));
            assertEquals(2, gen.kernels().size());
        }

        @Test
        void hostFunctionsAreRejected() {
            DeviceSourceGenerator gen = generator(BackendPolicies.CUDA, false);
            assertThrows(IllegalArgumentException.class,
                () -> gen.addFunction(CodegenFixtures.vectorAdd(DataType.FLOAT32)));
        }
    }
}
