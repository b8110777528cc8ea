package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.TelemetryBounds;

/**
 * 배치별 텔레메트리 범위 설정 (REGULATOR 전용). 기본 범위보다 우선합니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record SetBatchBounds(
    BatchId batchId,
    int minTemperature,
    int maxTemperature,
    int maxHumidity
) implements Command<TelemetryBounds> {

    public SetBatchBounds {
        if (batchId == null) {
            throw new IllegalArgumentException("batchId cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.SET_BATCH_BOUNDS;
    }
}
