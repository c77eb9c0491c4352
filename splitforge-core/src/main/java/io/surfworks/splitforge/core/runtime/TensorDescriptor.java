package io.surfworks.splitforge.core.runtime;

import io.surfworks.splitforge.core.dtype.DataType;

import java.util.Arrays;

/**
 * Call-time description of a tensor argument, mirroring the descriptor struct the
 * runtime passes across the host/device boundary.
 *
 * <p>Component order is the ABI order. {@code strides == null} means the tensor is
 * compact row-major.
 */
public record TensorDescriptor(
    int deviceType,
    int deviceId,
    int typeCode,
    int typeBits,
    int typeLanes,
    long[] shape,
    long[] strides,
    long byteOffset,
    long data
) {
    public static final int DEVICE_CPU = 1;
    public static final int DEVICE_CUDA = 2;
    public static final int DEVICE_ROCM = 10;

    public TensorDescriptor {
        shape = shape.clone();
        strides = strides == null ? null : strides.clone();
        if (strides != null && strides.length != shape.length) {
            throw new IllegalArgumentException(
                "strides length " + strides.length + " does not match rank " + shape.length);
        }
    }

    /**
     * A compact tensor of {@code dtype} on device 0 of {@code deviceType}.
     */
    public static TensorDescriptor of(int deviceType, DataType dtype, long... shape) {
        return new TensorDescriptor(deviceType, 0, dtype.code(), dtype.bits(), dtype.lanes(),
            shape, null, 0L, 0x1000L);
    }

    public int ndim() {
        return shape.length;
    }

    /**
     * Stride of dimension {@code i}, computing the compact stride when none were given.
     */
    public long stride(int i) {
        if (strides != null) {
            return strides[i];
        }
        long stride = 1;
        for (int d = i + 1; d < shape.length; d++) {
            stride *= shape[d];
        }
        return stride;
    }

    public TensorDescriptor withType(int code, int bits, int lanes) {
        return new TensorDescriptor(deviceType, deviceId, code, bits, lanes, shape, strides, byteOffset, data);
    }

    public TensorDescriptor withStrides(long... newStrides) {
        return new TensorDescriptor(deviceType, deviceId, typeCode, typeBits, typeLanes,
            shape, newStrides, byteOffset, data);
    }

    public TensorDescriptor withByteOffset(long offset) {
        return new TensorDescriptor(deviceType, deviceId, typeCode, typeBits, typeLanes,
            shape, strides, offset, data);
    }

    public TensorDescriptor withData(long address) {
        return new TensorDescriptor(deviceType, deviceId, typeCode, typeBits, typeLanes,
            shape, strides, byteOffset, address);
    }

    @Override
    public String toString() {
        return "TensorDescriptor[device=" + deviceType + ":" + deviceId
            + ", dtype=" + typeCode + "/" + typeBits + "x" + typeLanes
            + ", shape=" + Arrays.toString(shape)
            + ", strides=" + (strides == null ? "compact" : Arrays.toString(strides))
            + ", byteOffset=" + byteOffset + "]";
    }
}
