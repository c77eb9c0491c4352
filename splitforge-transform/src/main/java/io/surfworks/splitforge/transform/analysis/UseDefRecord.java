package io.surfworks.splitforge.transform.analysis;

import io.surfworks.splitforge.core.ir.Expr;
import io.surfworks.splitforge.core.ir.IterVar;
import io.surfworks.splitforge.core.ir.Var;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one {@link UseDefAnalyzer} pass.
 *
 * <p>All collections preserve first-encounter order. That order is reproducible
 * for identical IR, but consumers that expose an order externally must still sort
 * (see {@code CaptureOrdering}).
 *
 * @param useCounts     references per variable; variables first seen undefined are counted too
 * @param defCounts     definitions per variable (always 1 for SSA input)
 * @param outputHints   variables seen as a store target
 * @param undefined     variables used but not defined inside the analyzed scope
 * @param threadAxes    launch axes defined in the scope, first appearance only
 * @param launchExtents extent of each entry of {@code threadAxes}
 */
public record UseDefRecord(
    Map<Var, Integer> useCounts,
    Map<Var, Integer> defCounts,
    Set<Var> outputHints,
    Set<Var> undefined,
    List<IterVar> threadAxes,
    List<Expr> launchExtents
) {
    public UseDefRecord {
        useCounts = Collections.unmodifiableMap(new LinkedHashMap<>(useCounts));
        defCounts = Collections.unmodifiableMap(new LinkedHashMap<>(defCounts));
        outputHints = Collections.unmodifiableSet(new LinkedHashSet<>(outputHints));
        undefined = Collections.unmodifiableSet(new LinkedHashSet<>(undefined));
        threadAxes = List.copyOf(threadAxes);
        launchExtents = List.copyOf(launchExtents);
    }

    public int useCount(Var v) {
        return useCounts.getOrDefault(v, 0);
    }

    public int defCount(Var v) {
        return defCounts.getOrDefault(v, 0);
    }

    public boolean isOutputHint(Var v) {
        return outputHints.contains(v);
    }

    public boolean isDefined(Var v) {
        return defCounts.containsKey(v);
    }

    /**
     * Position of {@code v} in first-use order among the undefined variables, or -1.
     */
    public int firstUseIndex(Var v) {
        int i = 0;
        for (Var u : undefined) {
            if (u == v) {
                return i;
            }
            i++;
        }
        return -1;
    }
}
