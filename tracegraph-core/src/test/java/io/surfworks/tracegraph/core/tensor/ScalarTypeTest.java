package io.surfworks.tracegraph.core.tensor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScalarType")
class ScalarTypeTest {

    @Test
    @DisplayName("parses short names")
    void parsesShortNames() {
        assertEquals(ScalarType.F32, ScalarType.fromName("f32"));
        assertEquals(ScalarType.I64, ScalarType.fromName("i64"));
        assertEquals(ScalarType.BOOL, ScalarType.fromName("bool"));
    }

    @Test
    @DisplayName("parses PyTorch dtype names")
    void parsesPyTorchNames() {
        assertEquals(ScalarType.F32, ScalarType.fromName("float32"));
        assertEquals(ScalarType.I64, ScalarType.fromName("torch.int64"));
        assertEquals(ScalarType.BF16, ScalarType.fromName("torch.bfloat16"));
        assertEquals(ScalarType.F16, ScalarType.fromName("HALF"));
    }

    @Test
    @DisplayName("rejects unknown name")
    void rejectsUnknownName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ScalarType.fromName("complex64"));
        assertTrue(e.getMessage().contains("complex64"));
    }

    @Test
    @DisplayName("integer and floating are disjoint")
    void integerAndFloatingAreDisjoint() {
        for (ScalarType type : ScalarType.values()) {
            assertFalse(type.isInteger() && type.isFloating(), type.name());
        }
        assertTrue(ScalarType.I32.isInteger());
        assertFalse(ScalarType.BOOL.isInteger());
        assertTrue(ScalarType.F64.isFloating());
        assertEquals(8, ScalarType.F64.byteSize());
    }
}
