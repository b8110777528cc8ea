package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.TelemetryBounds;

/**
 * 레저 기본 텔레메트리 범위 설정 (REGULATOR 전용).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record SetTelemetryBounds(
    int minTemperature,
    int maxTemperature,
    int maxHumidity
) implements Command<TelemetryBounds> {

    @Override
    public CommandType type() {
        return CommandType.SET_TELEMETRY_BOUNDS;
    }
}
