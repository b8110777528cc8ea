package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.statemachine.BatchStatus;

/**
 * 상태 그래프를 따라 배치 상태 변경.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record UpdateStatus(
    BatchId batchId,
    BatchStatus newStatus,
    String reason
) implements Command<Batch> {

    public UpdateStatus {
        if (batchId == null || newStatus == null) {
            throw new IllegalArgumentException("batchId, newStatus cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.UPDATE_STATUS;
    }
}
