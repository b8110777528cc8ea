package com.pharbit.ledger.core.model;

/**
 * 텔레메트리 허용 범위.
 *
 * <p>온도는 섭씨 0.1도 단위 정수 (예: 25 = 2.5°C), 습도는 퍼센트 정수입니다.</p>
 *
 * @param minTemperature 최저 허용 온도 (0.1°C 단위)
 * @param maxTemperature 최고 허용 온도 (0.1°C 단위, minTemperature보다 커야 함)
 * @param maxHumidity 최대 허용 습도 (0~100%)
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record TelemetryBounds(
    int minTemperature,
    int maxTemperature,
    int maxHumidity
) {

    public TelemetryBounds {
        String violation = violation(minTemperature, maxTemperature, maxHumidity);
        if (violation != null) {
            throw new IllegalArgumentException(violation);
        }
    }

    /**
     * 범위 값 검증.
     *
     * @return 위반 사유, 유효하면 null
     */
    public static String violation(int minTemperature, int maxTemperature, int maxHumidity) {
        if (minTemperature >= maxTemperature) {
            return "minTemperature must be below maxTemperature (min: " + minTemperature
                + ", max: " + maxTemperature + ")";
        }
        if (maxHumidity < 0 || maxHumidity > 100) {
            return "maxHumidity must be within 0..100 (current: " + maxHumidity + ")";
        }
        return null;
    }

    /**
     * 측정값이 범위 안에 있는지 판정.
     *
     * @param temperature 온도 (0.1°C 단위)
     * @param humidity 습도 (%)
     * @return min ≤ temperature ≤ max 이고 humidity ≤ maxHumidity 이면 true
     */
    public boolean admits(int temperature, int humidity) {
        return temperature >= minTemperature
            && temperature <= maxTemperature
            && humidity <= maxHumidity;
    }
}
