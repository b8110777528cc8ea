package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;

/**
 * 회수/만료 배치 폐기 (REGULATOR 전용). RECALLED, EXPIRED에서만 허용.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record DestroyBatch(
    BatchId batchId,
    String reason
) implements Command<Batch> {

    public DestroyBatch {
        if (batchId == null) {
            throw new IllegalArgumentException("batchId cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.DESTROY_BATCH;
    }
}
