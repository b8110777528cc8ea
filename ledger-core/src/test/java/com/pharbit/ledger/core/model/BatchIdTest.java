package com.pharbit.ledger.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BatchId Value Object 테스트.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class BatchIdTest {

    @Test
    void of_ValidValue_CreatesBatchId() {
        BatchId batchId = BatchId.of("LOT-2026_001");

        assertEquals("LOT-2026_001", batchId.getValue());
        assertEquals(BatchId.of("LOT-2026_001"), batchId);
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> BatchId.of(null));
        assertEquals("BatchId cannot be null or blank", exception.getMessage());
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> BatchId.of("LOT 1"));
        assertThrows(IllegalArgumentException.class, () -> BatchId.of("LOT#1"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertDoesNotThrow(() -> BatchId.of("B".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> BatchId.of("B".repeat(65)));
    }
}
