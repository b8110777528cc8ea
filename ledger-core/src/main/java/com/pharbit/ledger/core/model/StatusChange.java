package com.pharbit.ledger.core.model;

import com.pharbit.ledger.core.statemachine.BatchStatus;

import java.time.Instant;

/**
 * 배치 상태 변경 이력 한 건. 배치별 append-only.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record StatusChange(
    BatchId batchId,
    BatchStatus from,
    BatchStatus to,
    Identity changedBy,
    String reason,
    Instant at
) {

    public StatusChange {
        if (batchId == null || from == null || to == null || changedBy == null || at == null) {
            throw new IllegalArgumentException("StatusChange fields cannot be null (batchId: " + batchId + ")");
        }
        reason = reason == null ? "" : reason;
    }
}
