package io.surfworks.splitforge.core.ir;

import io.surfworks.splitforge.core.dtype.DataType;

/**
 * Fields of the runtime tensor descriptor, in ABI order.
 *
 * <p>The order and the C member names are fixed by the runtime that builds the
 * descriptor; the compiler only reads them.
 */
public enum DescriptorField {
    DEVICE_TYPE("device_type", DataType.INT32, false),
    DEVICE_ID("device_id", DataType.INT32, false),
    NDIM("ndim", DataType.INT32, false),
    TYPE_CODE("dtype.code", DataType.UINT8, false),
    TYPE_BITS("dtype.bits", DataType.UINT8, false),
    TYPE_LANES("dtype.lanes", DataType.UINT16, false),
    SHAPE("shape", DataType.INT64, true),
    STRIDES("strides", DataType.INT64, true),
    HAS_STRIDES("strides", DataType.BOOL, false),
    BYTE_OFFSET("byte_offset", DataType.UINT64, false),
    DATA("data", DataType.HANDLE, false);

    private final String memberName;
    private final DataType dtype;
    private final boolean indexed;

    DescriptorField(String memberName, DataType dtype, boolean indexed) {
        this.memberName = memberName;
        this.dtype = dtype;
        this.indexed = indexed;
    }

    /**
     * C member path inside the descriptor struct.
     */
    public String memberName() {
        return memberName;
    }

    public DataType dtype() {
        return dtype;
    }

    /**
     * True for array fields read with an index (shape, strides).
     */
    public boolean isIndexed() {
        return indexed;
    }
}
