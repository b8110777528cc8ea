package com.pharbit.ledger.core.model;

import java.time.Instant;

/**
 * 센서 측정값 한 건.
 *
 * <p>{@code valid}는 수집 시점의 범위로 한 번만 계산되며, 이후 범위가 바뀌어도 다시 계산되지 않습니다.</p>
 *
 * @param batchId 대상 배치
 * @param index 배치 내 순번 (0부터)
 * @param temperature 온도 (0.1°C 단위)
 * @param humidity 습도 (%)
 * @param location 측정 위치
 * @param timestamp 센서가 보고한 측정 시각
 * @param device 기록한 디바이스 Identity
 * @param recordedAt 레저에 수집된 시각
 * @param valid 수집 시점 범위 판정 결과
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record TelemetryReading(
    BatchId batchId,
    int index,
    int temperature,
    int humidity,
    String location,
    Instant timestamp,
    Identity device,
    Instant recordedAt,
    boolean valid
) {

    public TelemetryReading {
        if (batchId == null || device == null || timestamp == null || recordedAt == null) {
            throw new IllegalArgumentException("TelemetryReading fields cannot be null (batchId: " + batchId + ")");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative (current: " + index + ")");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
    }
}
