package io.surfworks.splitforge.transform.binder;

import io.surfworks.splitforge.core.ir.BufferDeclaration;
import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.Stmt.AssertStmt;
import io.surfworks.splitforge.core.ir.Var;

import java.util.List;

/**
 * Checks and variable bindings generated for one tensor argument.
 *
 * @param declaration the compile-time declaration
 * @param handle      descriptor variable the runtime passes
 * @param checkExpr   conjunction of every assertion condition
 * @param assertions  checks in evaluation order: dtype, ndim, shape, strides, byte offset
 * @param extractions variables bound from the descriptor, in binding order
 */
public record BufferBinding(
    BufferDeclaration declaration,
    Var handle,
    Expr checkExpr,
    List<AssertStmt> assertions,
    List<Binding> extractions
) {
    public BufferBinding {
        assertions = List.copyOf(assertions);
        extractions = List.copyOf(extractions);
    }

    /**
     * {@code var} is bound to {@code value} for the rest of the function.
     */
    public record Binding(Var var, Expr value) {
    }
}
