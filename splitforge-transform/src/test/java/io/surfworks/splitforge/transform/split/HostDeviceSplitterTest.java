package io.surfworks.splitforge.transform.split;

import io.surfworks.splitforge.core.dtype.DataType;
import io.surfworks.splitforge.core.ir.BufferDeclaration;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.Expr.Load;
import io.surfworks.splitforge.core.ir.IrInvariantException;
import io.surfworks.splitforge.core.ir.IterVar;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Stmt;
import io.surfworks.splitforge.core.ir.Stmt.AttrStmt;
import io.surfworks.splitforge.core.ir.Stmt.For;
import io.surfworks.splitforge.core.ir.Stmt.LaunchExtent;
import io.surfworks.splitforge.core.ir.Stmt.LaunchKernel;
import io.surfworks.splitforge.core.ir.Stmt.LetStmt;
import io.surfworks.splitforge.core.ir.Stmt.Store;
import io.surfworks.splitforge.core.ir.Stmt.ThreadExtent;
import io.surfworks.splitforge.core.ir.Var;
import io.surfworks.splitforge.transform.IrFixtures;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("HostDeviceSplitter")
class HostDeviceSplitterTest {

    private final HostDeviceSplitter splitter = new HostDeviceSplitter();

    private static List<String> names(List<? extends Expr> vars) {
        List<String> names = new ArrayList<>();
        for (Expr e : vars) {
            names.add(((Var) e).name());
        }
        return names;
    }

    private static PrimFunc scalarFunction(String name, List<Var> params, Stmt body) {
        return new PrimFunc(name, params, Map.of(), body, PrimFunc.Kind.MIXED, List.of());
    }

    @Nested
    @DisplayName("Kernel extraction")
    class Extraction {

        @Test
        void extractsOneKernelWithOrderedParameters() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            SplitResult result = splitter.split(f.function);

            assertEquals(1, result.deviceFunctions().size());
            PrimFunc kernel = result.deviceFunctions().get(0);
            assertEquals("vadd_kernel0", kernel.name());
            assertEquals(PrimFunc.Kind.DEVICE, kernel.kind());
            assertEquals(List.of("A", "B", "n", "C"), names(kernel.params()));
            assertEquals(List.of(f.bx, f.tx), kernel.threadAxes());
        }

        @Test
        void hostLaunchPassesArgumentsInParameterOrder() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            SplitResult result = splitter.split(f.function);

            PrimFunc host = result.hostFunction();
            assertEquals(PrimFunc.Kind.HOST, host.kind());
            LaunchKernel launch = assertInstanceOf(LaunchKernel.class, host.body());
            assertEquals("vadd_kernel0", launch.kernelName());
            assertEquals(List.of(f.a.data(), f.b.data(), f.n, f.c.data()), launch.arguments());
            assertEquals(List.of("blockIdx.x", "threadIdx.x"),
                launch.launchExtents().stream().map(LaunchExtent::threadTag).toList());
        }

        @Test
        void pointerParametersAreFreshVariables() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            PrimFunc kernel = splitter.split(f.function).deviceFunctions().get(0);

            Var kernelA = kernel.params().get(0);
            assertNotSame(f.a.data(), kernelA);
            assertEquals(DataType.FLOAT32, kernelA.elementType());
            assertSame(f.n, kernel.params().get(2));
        }

        @Test
        void repeatedSplitsAgree() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            List<String> first = names(splitter.split(f.function).deviceFunctions().get(0).params());
            for (int i = 0; i < 10; i++) {
                assertEquals(first, names(new HostDeviceSplitter().split(f.function).deviceFunctions().get(0).params()));
            }
        }

        @Test
        void storedToCaptureSortsAfterReadOnlyOnes() {
            Var a = Var.pointer("a", DataType.FLOAT32);
            Var b = Var.pointer("b", DataType.FLOAT32);
            Var c = Var.pointer("c", DataType.FLOAT32);
            IterVar t = IterVar.threadIdx("x", "t");

            Stmt cFirst = new ThreadExtent(t, Expr.constant(4), new Store(a,
                Expr.add(new Load(DataType.FLOAT32, c, t.var()), new Load(DataType.FLOAT32, b, t.var())), t.var()));
            Stmt bFirst = new ThreadExtent(t, Expr.constant(4), new Store(a,
                Expr.add(new Load(DataType.FLOAT32, b, t.var()), new Load(DataType.FLOAT32, c, t.var())), t.var()));

            for (Stmt body : List.of(cFirst, bFirst)) {
                for (List<Var> params : List.of(List.of(a, b, c), List.of(c, a, b))) {
                    SplitResult result = splitter.split(scalarFunction("abc", params, body));
                    assertEquals(List.of("b", "c", "a"), names(result.deviceFunctions().get(0).params()));
                    LaunchKernel launch = assertInstanceOf(LaunchKernel.class, result.hostFunction().body());
                    assertEquals(List.of(b, c, a), launch.arguments());
                }
            }
        }

        @Test
        void multipleRegionsAreNumberedInOrder() {
            Var out = Var.pointer("out", DataType.INT32);
            IterVar t0 = IterVar.threadIdx("x", "t0");
            IterVar t1 = IterVar.threadIdx("x", "t1");
            Stmt body = Stmt.seq(
                new ThreadExtent(t0, Expr.constant(8), new Store(out, t0.var(), t0.var())),
                new ThreadExtent(t1, Expr.constant(4), new Store(out, Expr.constant(0), t1.var())));
            SplitResult result = splitter.split(scalarFunction("two", List.of(out), body));

            assertEquals(List.of("two_kernel0", "two_kernel1"),
                result.deviceFunctions().stream().map(PrimFunc::name).toList());
            assertTrue(result.deviceFunction("two_kernel1").isPresent());
        }

        @Test
        void deviceScopeAttributeStartsARegion() {
            Var out = Var.pointer("out", DataType.INT32);
            Var j = Var.int32("j");
            Stmt region = new AttrStmt(AttrStmt.DEVICE_SCOPE, null, Expr.constant(0), new Store(out, j, j));
            Stmt body = new For(j, Expr.constant(0), Expr.constant(4), Stmt.ForKind.SERIAL, region);
            SplitResult result = splitter.split(scalarFunction("loop", List.of(out), body));

            PrimFunc kernel = result.deviceFunctions().get(0);
            assertEquals(List.of("j", "out"), names(kernel.params()));
            For hostLoop = assertInstanceOf(For.class, result.hostFunction().body());
            assertInstanceOf(LaunchKernel.class, hostLoop.body());
        }

        @Test
        void launchExtentOnlyVariablesAreNotCaptured() {
            Var m = Var.int32("m");
            Var out = Var.pointer("out", DataType.INT32);
            IterVar tx = IterVar.threadIdx("x", "tx");
            Stmt body = new ThreadExtent(tx, m, new Store(out, tx.var(), tx.var()));
            SplitResult result = splitter.split(scalarFunction("fill", List.of(out, m), body));

            PrimFunc kernel = result.deviceFunctions().get(0);
            assertEquals(List.of("out"), names(kernel.params()));
            LaunchKernel launch = (LaunchKernel) result.hostFunction().body();
            assertSame(m, launch.launchExtents().get(0).extent());
        }
    }

    @Nested
    @DisplayName("Scope checks")
    class ScopeChecks {

        @Test
        void unresolvableCaptureIsFatal() {
            Var ghost = Var.int32("ghost");
            Var out = Var.pointer("out", DataType.INT32);
            IterVar tx = IterVar.threadIdx("x", "tx");
            Stmt body = new ThreadExtent(tx, Expr.constant(4), new Store(out, ghost, tx.var()));

            IrInvariantException e = assertThrows(IrInvariantException.class,
                () -> splitter.split(scalarFunction("bad", List.of(out), body)));
            assertTrue(e.getMessage().contains("ghost"));
        }

        @Test
        void launchExtentMustBeHostVisible() {
            Var out = Var.pointer("out", DataType.INT32);
            Var k = Var.int32("k");
            IterVar tx = IterVar.threadIdx("x", "tx");
            Stmt region = new AttrStmt(AttrStmt.DEVICE_SCOPE, null, Expr.constant(0),
                new LetStmt(k, Expr.constant(4),
                    new ThreadExtent(tx, k, new Store(out, tx.var(), tx.var()))));

            assertThrows(IrInvariantException.class,
                () -> splitter.split(scalarFunction("inner", List.of(out), region)));
        }

        @Test
        void letBoundHostValuesAreVisible() {
            Var out = Var.pointer("out", DataType.INT32);
            Var scale = Var.int32("scale");
            IterVar tx = IterVar.threadIdx("x", "tx");
            Stmt body = new LetStmt(scale, Expr.constant(3),
                new ThreadExtent(tx, Expr.constant(4), new Store(out, Expr.mul(tx.var(), scale), tx.var())));

            PrimFunc kernel = splitter.split(scalarFunction("scaled", List.of(out), body)).deviceFunctions().get(0);
            assertEquals(List.of("scale", "out"), names(kernel.params()));
        }
    }

    @Nested
    @DisplayName("Functions without device regions")
    class NoRegions {

        @Test
        void returnsSameInstance() {
            PrimFunc f = IrFixtures.hostOnly();
            SplitResult result = splitter.split(f);

            assertSame(f, result.hostFunction());
            assertFalse(result.hasDeviceCode());
        }

        @Test
        void splittingTheHostResultAgainIsANoOp() {
            SplitResult first = splitter.split(new IrFixtures.VectorAdd().function);
            SplitResult second = splitter.split(first.hostFunction());

            assertSame(first.hostFunction(), second.hostFunction());
            assertTrue(second.deviceFunctions().isEmpty());
        }

        @Test
        void deviceFunctionsAreNotSplitAgain() {
            PrimFunc kernel = splitter.split(new IrFixtures.VectorAdd().function).deviceFunctions().get(0);
            SplitResult again = splitter.split(kernel);
            assertSame(kernel, again.hostFunction());
            assertTrue(again.deviceFunctions().isEmpty());
        }

        @Test
        void bufferMapIsPreserved() {
            IrFixtures.VectorAdd f = new IrFixtures.VectorAdd();
            Map<Var, BufferDeclaration> expected = new LinkedHashMap<>(f.function.bufferMap());
            assertEquals(new ArrayList<>(expected.keySet()),
                new ArrayList<>(splitter.split(f.function).hostFunction().bufferMap().keySet()));
        }
    }
}
