package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.Identity;

/**
 * SENSOR_DEVICE를 배치에 바인딩/해제 (ADMIN 전용). 결과 값은 실제 변경 여부.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record BindSensor(
    BatchId batchId,
    Identity device,
    boolean bound
) implements Command<Boolean> {

    public BindSensor {
        if (batchId == null || device == null) {
            throw new IllegalArgumentException("batchId, device cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.BIND_SENSOR;
    }
}
