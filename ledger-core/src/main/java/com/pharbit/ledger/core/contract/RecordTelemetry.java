package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.TelemetryReading;

import java.time.Instant;

/**
 * 센서 측정값 기록. 온도는 0.1°C 단위, 습도는 %.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RecordTelemetry(
    BatchId batchId,
    int temperature,
    int humidity,
    String location,
    Instant timestamp
) implements Command<TelemetryReading> {

    public RecordTelemetry {
        if (batchId == null || timestamp == null) {
            throw new IllegalArgumentException("batchId, timestamp cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.RECORD_TELEMETRY;
    }
}
