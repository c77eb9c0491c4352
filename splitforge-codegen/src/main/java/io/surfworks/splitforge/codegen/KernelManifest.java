package io.surfworks.splitforge.codegen;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import io.surfworks.splitforge.core.ir.IterVar;
import io.surfworks.splitforge.core.ir.PrimFunc;
import io.surfworks.splitforge.core.ir.Var;

import java.util.ArrayList;
import java.util.List;

/**
 * The binary interface of a compiled program's kernels: for each kernel, its
 * parameters in ABI order and its launch axes.
 *
 * <p>Argument-packing code reads this instead of the generated source. Its JSON
 * form is identical for identical input programs.
 *
 * @param function source function name
 * @param target   device backend identifier
 * @param kernels  kernels in launch order
 */
public record KernelManifest(String function, String target, List<Kernel> kernels) {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    public KernelManifest {
        kernels = List.copyOf(kernels);
    }

    /**
     * @param name       kernel symbol
     * @param parameters parameters in ABI order
     * @param launchAxes thread tags, outermost first
     */
    public record Kernel(String name, List<Parameter> parameters, List<String> launchAxes) {
        public Kernel {
            parameters = List.copyOf(parameters);
            launchAxes = List.copyOf(launchAxes);
        }
    }

    /**
     * @param name    parameter name as printed
     * @param type    parameter type as printed
     * @param dtype   IR data type; for pointers, the element type when known
     * @param pointer whether the parameter is a buffer pointer
     */
    public record Parameter(String name, String type, String dtype, boolean pointer) {
    }

    /**
     * Describe {@code kernels}, taking printed names and types from {@code sources}.
     */
    public static KernelManifest of(String function, String target, List<PrimFunc> kernels,
                                    List<KernelSource> sources) {
        if (kernels.size() != sources.size()) {
            throw new IllegalArgumentException(
                "Got " + kernels.size() + " kernels but " + sources.size() + " sources");
        }
        List<Kernel> entries = new ArrayList<>();
        for (int k = 0; k < kernels.size(); k++) {
            PrimFunc kernel = kernels.get(k);
            KernelSource source = sources.get(k);
            List<Parameter> params = new ArrayList<>();
            for (int i = 0; i < kernel.params().size(); i++) {
                Var p = kernel.params().get(i);
                boolean pointer = p.dtype().isHandle();
                String dtype = pointer && p.elementType() != null ? p.elementType().toString() : p.dtype().toString();
                params.add(new Parameter(source.parameterNames().get(i), source.parameterTypes().get(i), dtype, pointer));
            }
            entries.add(new Kernel(kernel.name(), params,
                kernel.threadAxes().stream().map(IterVar::threadTag).toList()));
        }
        return new KernelManifest(function, target, entries);
    }

    public String toJson() {
        StoredManifest stored = new StoredManifest();
        stored.function = function;
        stored.target = target;
        stored.kernels = new ArrayList<>();
        for (Kernel k : kernels) {
            StoredKernel sk = new StoredKernel();
            sk.name = k.name();
            sk.launchAxes = new ArrayList<>(k.launchAxes());
            sk.parameters = new ArrayList<>();
            for (Parameter p : k.parameters()) {
                StoredParameter sp = new StoredParameter();
                sp.name = p.name();
                sp.type = p.type();
                sp.dtype = p.dtype();
                sp.pointer = p.pointer();
                sk.parameters.add(sp);
            }
            stored.kernels.add(sk);
        }
        return GSON.toJson(stored);
    }

    /**
     * @throws IllegalArgumentException if {@code json} is not a manifest
     */
    public static KernelManifest fromJson(String json) {
        StoredManifest stored;
        try {
            stored = GSON.fromJson(json, StoredManifest.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed kernel manifest", e);
        }
        if (stored == null || stored.function == null || stored.target == null) {
            throw new IllegalArgumentException("Kernel manifest is missing function or target");
        }
        List<Kernel> kernels = new ArrayList<>();
        if (stored.kernels != null) {
            for (StoredKernel sk : stored.kernels) {
                List<Parameter> params = new ArrayList<>();
                if (sk.parameters != null) {
                    for (StoredParameter sp : sk.parameters) {
                        params.add(new Parameter(sp.name, sp.type, sp.dtype, sp.pointer));
                    }
                }
                kernels.add(new Kernel(sk.name, params, sk.launchAxes != null ? sk.launchAxes : List.of()));
            }
        }
        return new KernelManifest(stored.function, stored.target, kernels);
    }

    // ==================== JSON shape ====================

    private static class StoredManifest {
        String function;
        String target;
        List<StoredKernel> kernels;
    }

    private static class StoredKernel {
        String name;
        List<StoredParameter> parameters;
        List<String> launchAxes;
    }

    private static class StoredParameter {
        String name;
        String type;
        String dtype;
        boolean pointer;
    }
}
