package com.pharbit.ledger.core.model;

/**
 * 규정 준수 기록 식별자 (배치 + 배치 내 순번, 1부터).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record ComplianceRecordId(BatchId batchId, int sequence) {

    public ComplianceRecordId {
        if (batchId == null) {
            throw new IllegalArgumentException("batchId cannot be null");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
    }

    public static ComplianceRecordId of(BatchId batchId, int sequence) {
        return new ComplianceRecordId(batchId, sequence);
    }

    @Override
    public String toString() {
        return batchId.getValue() + "#" + sequence;
    }
}
