package io.surfworks.splitforge.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A compiled function: parameters, buffer declarations and a statement body.
 *
 * <p>{@code bufferMap} maps handle parameters to the tensor they receive. It keeps
 * insertion order, which is the order arguments are bound in.
 *
 * @param name       function name, also the prefix of extracted kernel names
 * @param params     parameters in call order
 * @param bufferMap  handle parameter to buffer declaration
 * @param body       function body
 * @param kind       where the function runs
 * @param threadAxes launch axes of a device function, empty otherwise
 */
public record PrimFunc(
    String name,
    List<Var> params,
    Map<Var, BufferDeclaration> bufferMap,
    Stmt body,
    Kind kind,
    List<IterVar> threadAxes
) {
    public enum Kind {
        /** Not yet split: may contain device regions. */
        MIXED,
        HOST,
        DEVICE
    }

    public PrimFunc {
        params = List.copyOf(params);
        bufferMap = Collections.unmodifiableMap(new LinkedHashMap<>(bufferMap));
        threadAxes = List.copyOf(threadAxes);
        for (Var handle : bufferMap.keySet()) {
            if (!params.contains(handle)) {
                throw new IllegalArgumentException(
                    "Buffer handle " + handle.name() + " is not a parameter of " + name);
            }
        }
    }

    /**
     * Create an unsplit function whose parameters are exactly the buffer handles.
     */
    public static PrimFunc of(String name, Map<Var, BufferDeclaration> buffers, Stmt body) {
        return new PrimFunc(name, new ArrayList<>(buffers.keySet()), buffers, body, Kind.MIXED, List.of());
    }

    public PrimFunc withBody(Stmt newBody) {
        return new PrimFunc(name, params, bufferMap, newBody, kind, threadAxes);
    }

    public PrimFunc withKind(Kind newKind) {
        return new PrimFunc(name, params, bufferMap, body, newKind, threadAxes);
    }

    /**
     * Variables visible at the top of the body: parameters, buffer data pointers
     * and symbolic shape/stride variables.
     */
    public List<Var> entryScope() {
        List<Var> scope = new ArrayList<>(params);
        for (BufferDeclaration decl : bufferMap.values()) {
            if (!scope.contains(decl.data())) {
                scope.add(decl.data());
            }
            for (Var v : decl.symbolicVars()) {
                if (!scope.contains(v)) {
                    scope.add(v);
                }
            }
        }
        return scope;
    }
}
