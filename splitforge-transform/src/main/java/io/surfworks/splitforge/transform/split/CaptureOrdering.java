package io.surfworks.splitforge.transform.split;

import io.surfworks.splitforge.core.ir.Var;
import io.surfworks.splitforge.transform.analysis.UseDefRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * The parameter order of extracted kernels.
 *
 * <p>Captured variables sort ascending on {@code (isOutputHint, name)}: variables
 * never stored to come first, then stored-to variables, each group by name. The
 * output hint is only a grouping key, not a claim about data flow. Two distinct
 * variables sharing a name and hint fall back to their dtype text and then to
 * first-use position, which is itself fixed for identical IR.
 *
 * <p>Kernel ABIs, cached binaries and argument packing code all depend on this
 * order, so it must never depend on hash or set iteration order.
 */
public final class CaptureOrdering {

    private CaptureOrdering() {}

    /**
     * Order the capture set of an analyzed region. The capture set is held in
     * first-use order, which the stable sort keeps for full ties.
     */
    public static List<Var> order(UseDefRecord record) {
        return order(record.undefined(), record.outputHints());
    }

    /**
     * Order a variable collection given its output-hint members.
     * Variables that tie on name, hint and dtype keep their relative input order.
     */
    public static List<Var> order(Collection<Var> vars, Set<Var> outputHints) {
        List<Var> sorted = new ArrayList<>(vars);
        sorted.sort(comparator(outputHints));
        return sorted;
    }

    private static Comparator<Var> comparator(Set<Var> outputHints) {
        return Comparator.comparing((Var v) -> outputHints.contains(v))
            .thenComparing(Var::name)
            .thenComparing(v -> v.dtype().toString());
    }
}
