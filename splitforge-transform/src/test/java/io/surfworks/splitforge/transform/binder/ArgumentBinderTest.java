package io.surfworks.splitforge.transform.binder;

import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.ir.BufferDeclaration;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Stmt.Evaluate;
import io.surfworks.splitforge.core.ir.Stmt.MismatchKind;
import io.surfworks.splitforge.core.ir.Var;
import io.surfworks.splitforge.core.runtime.EntryInterpreter;
import io.surfworks.splitforge.core.runtime.ExprEvaluator;
import io.surfworks.splitforge.core.runtime.KernelInvocation;
import io.surfworks.splitforge.core.runtime.ShapeMismatchException;
import io.surfworks.splitforge.core.runtime.TensorDescriptor;
import io.surfworks.splitforge.core.runtime.TypeMismatchException;
import io.surfworks.splitforge.transform.IrFixtures;
import io.surfworks.splitforge.transform.analysis.UseDefAnalyzer;
import io.surfworks.splitforge.transform.split.HostDeviceSplitter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ArgumentBinder")
class ArgumentBinderTest {

    private static final int CUDA = TensorDescriptor.DEVICE_CUDA;

    private final Var handle = new Var("X_handle", DataType.HANDLE);

    private static BufferDeclaration decl(DataType dtype, Expr... shape) {
        return BufferDeclaration.of("X", dtype, List.of(shape), BufferDeclaration.Kind.INPUT);
    }

    private boolean check(BufferBinding binding, TensorDescriptor runtime) {
        ExprEvaluator evaluator = new ExprEvaluator();
        evaluator.bind(binding.handle(), runtime);
        return evaluator.evaluateBool(binding.checkExpr());
    }

    @Nested
    @DisplayName("Type checks")
    class TypeChecks {

        @Test
        void builtInTypeMustMatchExactly() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.INT32, Expr.constant(8)), handle);

            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 8)));
            assertTrue(check(binding, TensorDescriptor.of(CUDA, DataType.INT32, 8)));
        }

        @Test
        void builtInLanesAreChecked() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, Expr.constant(8)), handle);
            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32.withLanes(4), 8)));
        }

        @Test
        void customTypeAcceptsAnyCustomCode() {
            DataType declared = new DataType.Custom(DataType.CUSTOM_BEGIN, 16, 1);
            DataType runtime = new DataType.Custom(DataType.CUSTOM_BEGIN + 1, 16, 1);
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(declared, Expr.constant(8)), handle);

            assertTrue(check(binding, TensorDescriptor.of(CUDA, runtime, 8)));
        }

        @Test
        void customTypeRejectsBuiltInCode() {
            DataType declared = new DataType.Custom(DataType.CUSTOM_BEGIN, 16, 1);
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(declared, Expr.constant(8)), handle);

            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT16, 8)));
        }

        @Test
        void customTypeIgnoresBitsAndLanes() {
            DataType declared = new DataType.Custom(DataType.CUSTOM_BEGIN, 16, 1);
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(declared, Expr.constant(8)), handle);

            assertTrue(check(binding,
                TensorDescriptor.of(CUDA, new DataType.Custom(DataType.CUSTOM_BEGIN + 1, 32, 1), 8)));
            assertTrue(check(binding,
                TensorDescriptor.of(CUDA, new DataType.Custom(DataType.CUSTOM_BEGIN, 16, 4), 8)));
            assertEquals(1, binding.assertions().stream()
                .filter(a -> a.kind() == MismatchKind.TYPE).count());
        }
    }

    @Nested
    @DisplayName("Shape checks")
    class ShapeChecks {

        @Test
        void rankAndConstantExtents() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(
                decl(DataType.FLOAT32, Expr.constant(4), Expr.constant(8)), handle);

            assertTrue(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 4, 8)));
            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 4, 9)));
            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 32)));
        }

        @Test
        void firstSymbolicExtentIsExtracted() {
            Var n = Var.int32("n");
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, n), handle);

            assertEquals(n, binding.extractions().get(0).var());
            assertTrue(binding.extractions().stream().anyMatch(b -> b.var() == binding.declaration().data()));
            assertTrue(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 123)));
        }

        @Test
        void repeatedSymbolicExtentBecomesACheck() {
            Var n = Var.int32("n");
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, n, n), handle);

            assertEquals(1, binding.extractions().stream().filter(b -> b.var() == n).count());
            assertTrue(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 5, 5)));
            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 5, 6)));
        }

        @Test
        void constantExtentIsComparedAtDescriptorWidth() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, Expr.constant(4)), handle);

            assertTrue(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 4)));
            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 4294967300L)));
        }

        @Test
        void repeatedSymbolicExtentIsComparedAtDescriptorWidth() {
            Var n = Var.int32("n");
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, n, n), handle);

            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 4, 4294967300L)));
        }

        @Test
        void stridedRuntimeTensorFailsCompactDeclaration() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(
                decl(DataType.FLOAT32, Expr.constant(4), Expr.constant(8)), handle);

            TensorDescriptor compact = TensorDescriptor.of(CUDA, DataType.FLOAT32, 4, 8);
            assertTrue(check(binding, compact.withStrides(8, 1)));
            assertFalse(check(binding, compact.withStrides(16, 1)));
        }

        @Test
        void declaredStridesAreChecked() {
            BufferDeclaration strided = new BufferDeclaration("X", DataType.FLOAT32,
                Var.pointer("X", DataType.FLOAT32), List.of(Expr.constant(4), Expr.constant(8)),
                List.of(Expr.constant64(16), Expr.constant64(1)), BufferDeclaration.Kind.INPUT);
            BufferBinding binding = new ArgumentBinder().bindBuffer(strided, handle);

            TensorDescriptor runtime = TensorDescriptor.of(CUDA, DataType.FLOAT32, 4, 8);
            assertTrue(check(binding, runtime.withStrides(16, 1)));
            assertFalse(check(binding, runtime));
        }

        @Test
        void nonZeroByteOffsetFails() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, Expr.constant(8)), handle);
            assertFalse(check(binding, TensorDescriptor.of(CUDA, DataType.FLOAT32, 8).withByteOffset(64)));
        }

        @Test
        void assertionsAreOrderedTypeThenShape() {
            BufferBinding binding = new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, Expr.constant(8)), handle);
            List<AssertStmt> asserts = binding.assertions();

            assertEquals(MismatchKind.TYPE, asserts.get(0).kind());
            assertEquals("dtype.code", asserts.get(0).field());
            assertEquals("ndim", asserts.get(3).field());
            assertEquals("byte_offset", asserts.get(asserts.size() - 1).field());
        }

        @Test
        void nonHandleDescriptorIsRejected() {
            assertThrows(IllegalArgumentException.class,
                () -> new ArgumentBinder().bindBuffer(decl(DataType.FLOAT32, Expr.constant(8)), Var.int32("h")));
        }
    }

    @Nested
    @DisplayName("Function entry sequence")
    class EntrySequence {

        private Map<Var, Object> arguments(IrFixtures.VectorAdd f, TensorDescriptor a, TensorDescriptor b,
                                           TensorDescriptor c) {
            Map<Var, Object> args = new HashMap<>();
            args.put(f.aHandle, a);
            args.put(f.bHandle, b);
            args.put(f.cHandle, c);
            return args;
        }

        private TensorDescriptor vector(long length, long data) {
            return TensorDescriptor.of(CUDA, DataType.FLOAT32, length).withData(data);
        }

        @Test
        void validArgumentsReachTheLaunch() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            PrimFunc host = new HostDeviceSplitter().split(ArgumentBinder.bindFunction(f.function)).hostFunction();

            List<KernelInvocation> launches = new EntryInterpreter(host)
                .run(arguments(f, vector(100, 0x1000), vector(100, 0x2000), vector(100, 0x3000)));

            assertEquals(1, launches.size());
            KernelInvocation launch = launches.get(0);
            assertEquals("vadd_kernel0", launch.kernelName());
            assertEquals(List.of(0x1000L, 0x2000L, 100L, 0x3000L), launch.arguments());
            assertEquals(2L, launch.launch().get("blockIdx.x"));
            assertEquals(64L, launch.launch().get("threadIdx.x"));
        }

        @Test
        void sharedSymbolicExtentIsCheckedAcrossBuffers() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            PrimFunc host = new HostDeviceSplitter().split(ArgumentBinder.bindFunction(f.function)).hostFunction();

            ShapeMismatchException e = assertThrows(ShapeMismatchException.class, () -> new EntryInterpreter(host)
                .run(arguments(f, vector(100, 0x1000), vector(100, 0x2000), vector(99, 0x3000))));
            assertEquals("C", e.argName());
            assertEquals("shape[0]", e.field());
            assertEquals(100L, e.expected());
            assertEquals(99L, e.actual());
        }

        @Test
        void wrongElementTypeRaisesTypeMismatch() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            PrimFunc bound = ArgumentBinder.bindFunction(f.function);
            TensorDescriptor ints = TensorDescriptor.of(CUDA, DataType.INT32, 100);

            TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> new EntryInterpreter(
                new HostDeviceSplitter().split(bound).hostFunction())
                .run(arguments(f, vector(100, 0x1000), ints, vector(100, 0x3000))));
            assertEquals("B", e.argName());
            assertEquals("dtype.code", e.field());
        }

        @Test
        void failedCheckStopsBeforeTheBody() {
            PrimFunc bound = ArgumentBinder.bindFunction(IrFixtures.hostOnly());
            Var in = bound.params().get(0);
            Var out = bound.params().get(1);
            Map<Var, Object> args = new HashMap<>();
            args.put(in, TensorDescriptor.of(CUDA, DataType.INT32, 1));
            args.put(out, TensorDescriptor.of(CUDA, DataType.INT32, 2));

            ShapeMismatchException e = assertThrows(ShapeMismatchException.class,
                () -> new EntryInterpreter(bound).run(args));
            assertEquals("out", e.argName());
        }

        @Test
        void functionWithoutBuffersIsUnchanged() {
            PrimFunc bare = new PrimFunc("bare", List.of(), Map.of(),
                new Evaluate(Expr.constant(0)), PrimFunc.Kind.MIXED, List.of());
            assertSame(bare, ArgumentBinder.bindFunction(bare));
        }

        @Test
        void boundFunctionStillAnalyzes() {
            PrimFunc bound = ArgumentBinder.bindFunction(new IrFixtures.VectorAdd().function);
            assertDoesNotThrow(() -> new UseDefAnalyzer(true)
                .analyzeFunction(bound));
        }
    }
}
