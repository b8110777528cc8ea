package com.pharbit.ledger.core.model;

/**
 * 통과 시 레저 기본 텔레메트리 범위를 교체하는 작업.
 *
 * <p>값은 제안 생성 시점에 검증되며, 범위가 잘못되면 제안 생성이 BAD_INPUT으로 거부됩니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record UpdateBoundsAction(int minTemperature, int maxTemperature, int maxHumidity)
    implements ProposalAction {

    public TelemetryBounds toBounds() {
        return new TelemetryBounds(minTemperature, maxTemperature, maxHumidity);
    }

    @Override
    public String summary() {
        return "bounds " + minTemperature + ".." + maxTemperature + " humidity<=" + maxHumidity;
    }
}
