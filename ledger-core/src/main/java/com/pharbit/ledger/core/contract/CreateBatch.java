package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.Identity;

import java.time.Instant;

/**
 * 배치 생성 (PRODUCER 전용). 초기 상태는 PRODUCED.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record CreateBatch(
    BatchId batchId,
    String productName,
    Identity producer,
    long quantity,
    Instant manufactureDate,
    Instant expiryDate,
    Identity custodian
) implements Command<Batch> {

    public CreateBatch {
        if (batchId == null
            || productName == null
            || producer == null
            || manufactureDate == null
            || expiryDate == null
            || custodian == null) {
            throw new IllegalArgumentException("batchId, productName, producer, manufactureDate, expiryDate, custodian cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.CREATE_BATCH;
    }
}
