package io.surfworks.splitforge.core.ir;

import io.surfworks.splitforge.core.dtype.DataType;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement nodes of the IR.
 */
public sealed interface Stmt permits Stmt.LetStmt, Stmt.AttrStmt, Stmt.ThreadExtent, Stmt.For,
        Stmt.IfThenElse, Stmt.SeqStmt, Stmt.Allocate, Stmt.Store, Stmt.Evaluate,
        Stmt.AssertStmt, Stmt.LaunchKernel {

    /**
     * Flatten statements into a sequence, dropping nested sequence wrappers.
     */
    static Stmt seq(Stmt... stmts) {
        return seq(List.of(stmts));
    }

    static Stmt seq(List<Stmt> stmts) {
        List<Stmt> flat = new ArrayList<>();
        for (Stmt s : stmts) {
            if (s instanceof SeqStmt inner) {
                flat.addAll(inner.stmts());
            } else {
                flat.add(s);
            }
        }
        return flat.size() == 1 ? flat.get(0) : new SeqStmt(flat);
    }

    /**
     * Binds {@code var} to {@code value} for the extent of {@code body}.
     */
    record LetStmt(Var var, Expr value, Stmt body) implements Stmt {
    }

    /**
     * Generic annotation. Keys with meaning to the compiler are the constants below;
     * anything else is carried through untouched.
     *
     * @param key   annotation key
     * @param node  variable the annotation refers to, or null
     * @param value annotation value
     * @param body  annotated statement
     */
    record AttrStmt(String key, Var node, Expr value, Stmt body) implements Stmt {

        /** Marks {@code body} as device code without binding a launch axis. */
        public static final String DEVICE_SCOPE = "device_scope";

        /** Marks the buffer {@code node} as volatile for the extent of {@code body}. */
        public static final String VOLATILE_SCOPE = "volatile_scope";

        /** Loop unrolling hint, printed as a pragma by device generators. */
        public static final String PRAGMA_UNROLL = "pragma_unroll";
    }

    /**
     * Launch annotation: {@code body} runs with {@code iterVar} ranging over
     * {@code [0, extent)} of its hardware axis.
     */
    record ThreadExtent(IterVar iterVar, Expr extent, Stmt body) implements Stmt {
    }

    record For(Var loopVar, Expr min, Expr extent, ForKind kind, Stmt body) implements Stmt {
    }

    enum ForKind { SERIAL, UNROLLED }

    /**
     * @param elseCase may be null
     */
    record IfThenElse(Expr condition, Stmt thenCase, Stmt elseCase) implements Stmt {
    }

    record SeqStmt(List<Stmt> stmts) implements Stmt {
        public SeqStmt {
            stmts = List.copyOf(stmts);
        }
    }

    /**
     * Allocates storage for {@code buffer} visible in {@code body}.
     *
     * @param storageScope {@code global}, {@code shared} or {@code local}
     */
    record Allocate(Var buffer, DataType dtype, List<Expr> extents, String storageScope, Stmt body)
            implements Stmt {
        public Allocate {
            extents = List.copyOf(extents);
        }
    }

    /**
     * {@code buffer[index] = value}.
     */
    record Store(Var buffer, Expr value, Expr index) implements Stmt {
    }

    record Evaluate(Expr value) implements Stmt {
    }

    /**
     * Runtime argument check. When {@code condition} is false the program fails
     * with an error of {@code kind} naming {@code argName}/{@code field} and
     * reporting {@code expected} against {@code actual}.
     */
    record AssertStmt(Expr condition, MismatchKind kind, String argName, String field,
                      Expr expected, Expr actual) implements Stmt {

        public String message() {
            return argName + "." + field + " mismatch: expected " + expected + ", got " + actual;
        }
    }

    enum MismatchKind { TYPE, SHAPE }

    /**
     * Host-side launch of an extracted kernel.
     *
     * @param kernelName    device function name
     * @param arguments     kernel arguments, in parameter order
     * @param launchExtents launch axes and their host-computed extents
     */
    record LaunchKernel(String kernelName, List<Expr> arguments, List<LaunchExtent> launchExtents)
            implements Stmt {
        public LaunchKernel {
            arguments = List.copyOf(arguments);
            launchExtents = List.copyOf(launchExtents);
        }
    }

    record LaunchExtent(String threadTag, Expr extent) {
    }
}
