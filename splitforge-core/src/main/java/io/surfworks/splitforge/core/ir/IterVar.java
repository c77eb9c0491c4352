package io.surfworks.splitforge.core.ir;

/**
 * A launch axis: a variable bound to a hardware thread index such as
 * {@code blockIdx.x} or {@code threadIdx.y}.
 *
 * @param var       the index variable
 * @param threadTag the hardware index it is bound to
 */
public record IterVar(Var var, String threadTag) {

    public IterVar {
        if (var == null) {
            throw new IllegalArgumentException("var must not be null");
        }
        if (threadTag == null || threadTag.isEmpty()) {
            throw new IllegalArgumentException("Launch axis " + var.name() + " has no thread tag");
        }
    }

    public static IterVar blockIdx(String axis, String name) {
        return new IterVar(Var.int32(name), "blockIdx." + axis);
    }

    public static IterVar threadIdx(String axis, String name) {
        return new IterVar(Var.int32(name), "threadIdx." + axis);
    }

    public boolean isBlockAxis() {
        return threadTag.startsWith("blockIdx.");
    }

    public boolean isThreadAxis() {
        return threadTag.startsWith("threadIdx.");
    }

    /**
     * Axis letter: {@code x}, {@code y} or {@code z}.
     */
    public String axis() {
        int dot = threadTag.lastIndexOf('.');
        return dot < 0 ? threadTag : threadTag.substring(dot + 1);
    }
}
