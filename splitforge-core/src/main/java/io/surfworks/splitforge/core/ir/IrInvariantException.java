package io.surfworks.splitforge.core.ir;

/**
 * Internal compiler error: the IR handed to a pass violates an invariant the pass
 * relies on (non-SSA definitions, a captured variable with no declaration, ...).
 *
 * <p>Never recoverable. Report it with the offending function.
 */
public class IrInvariantException extends RuntimeException {

    public IrInvariantException(String message) {
        super(message);
    }

    public static IrInvariantException redefined(Var var) {
        return new IrInvariantException(
            "Variable '" + var.name() + "' has already been defined; the IR is not in SSA form");
    }

    public static IrInvariantException usedBeforeDefinition(Var var) {
        return new IrInvariantException("Variable '" + var.name() + "' is used before its definition");
    }

    public static IrInvariantException unresolvedCapture(Var var, String kernel) {
        return new IrInvariantException(
            "Kernel " + kernel + " captures '" + var.name() + "', which has no declaration in the host scope");
    }
}
