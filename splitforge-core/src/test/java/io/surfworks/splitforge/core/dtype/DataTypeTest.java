package io.surfworks.splitforge.core.dtype;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataTypeTest {

    @Test
    void codesAtOrAboveThresholdAreCustom() {
        assertInstanceOf(DataType.Custom.class, DataType.of(DataType.CUSTOM_BEGIN, 16, 1));
        assertInstanceOf(DataType.Custom.class, DataType.of(255, 8, 1));
        assertTrue(DataType.of(DataType.CUSTOM_BEGIN, 16, 1).isCustom());
    }

    @Test
    void builtInCodesMapToKinds() {
        assertEquals(DataType.FLOAT32, DataType.of(2, 32, 1));
        assertEquals(DataType.INT32, DataType.of(0, 32, 1));
        assertEquals(DataType.BFLOAT16, DataType.of(4, 16, 1));
        assertFalse(DataType.of(0, 32, 1).isCustom());
    }

    @Test
    void reservedCodesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DataType.of(5, 32, 1));
        assertThrows(IllegalArgumentException.class, () -> DataType.of(DataType.CUSTOM_BEGIN - 1, 32, 1));
    }

    @Test
    void customRecordRejectsLowCodes() {
        assertThrows(IllegalArgumentException.class, () -> new DataType.Custom(3, 16, 1));
    }

    @Test
    void printedForms() {
        assertEquals("float32", DataType.FLOAT32.toString());
        assertEquals("int32x4", DataType.INT32.withLanes(4).toString());
        assertEquals("bool", DataType.BOOL.toString());
        assertEquals("handle", DataType.HANDLE.toString());
        assertEquals("custom[129]16", new DataType.Custom(129, 16, 1).toString());
    }

    @Test
    void predicates() {
        assertTrue(DataType.BOOL.isBool());
        assertFalse(DataType.UINT8.isBool());
        assertTrue(DataType.HANDLE.isHandle());
        assertTrue(DataType.FLOAT16.isFloating());
        assertFalse(DataType.INT64.isFloating());
        assertFalse(DataType.FLOAT32.withLanes(2).isScalar());
    }
}
