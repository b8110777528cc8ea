package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.model.TelemetryBounds;

import java.time.Duration;

/**
 * 리듀서 정책 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>stalenessWindow: 텔레메트리 타임스탬프 허용 과거 범위 (기본 1일)</li>
 *   <li>minVotingPeriod: 제안 투표 기간 최솟값 (기본 1분)</li>
 *   <li>maxVotingPeriod: 제안 투표 기간 최댓값 (기본 30일)</li>
 *   <li>defaultBounds: 규제 기관이 범위를 설정하기 전 사용할 텔레메트리 범위
 *       (기본 -20.0°C ~ 40.0°C, 습도 90%)</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 * @param stalenessWindow 허용 과거 범위 (양수)
 * @param minVotingPeriod 최소 투표 기간 (양수)
 * @param maxVotingPeriod 최대 투표 기간 (minVotingPeriod 이상)
 * @param defaultBounds 기본 텔레메트리 범위
 */
public record LedgerPolicy(
    Duration stalenessWindow,
    Duration minVotingPeriod,
    Duration maxVotingPeriod,
    TelemetryBounds defaultBounds
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: stalenessWindow=1일, minVotingPeriod=1분, maxVotingPeriod=30일,
     * defaultBounds=(-200, 400, 90)</p>
     */
    public LedgerPolicy() {
        this(Duration.ofDays(1), Duration.ofMinutes(1), Duration.ofDays(30), new TelemetryBounds(-200, 400, 90));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LedgerPolicy {
        if (stalenessWindow == null || stalenessWindow.isNegative() || stalenessWindow.isZero()) {
            throw new IllegalArgumentException(
                "stalenessWindow must be positive (current: " + stalenessWindow + ")"
            );
        }
        if (minVotingPeriod == null || minVotingPeriod.isNegative() || minVotingPeriod.isZero()) {
            throw new IllegalArgumentException(
                "minVotingPeriod must be positive (current: " + minVotingPeriod + ")"
            );
        }
        if (maxVotingPeriod == null || maxVotingPeriod.compareTo(minVotingPeriod) < 0) {
            throw new IllegalArgumentException(
                "maxVotingPeriod must not be shorter than minVotingPeriod (current: " + maxVotingPeriod + ")"
            );
        }
        if (defaultBounds == null) {
            throw new IllegalArgumentException("defaultBounds cannot be null");
        }
    }

    /**
     * stalenessWindow만 변경한 새 인스턴스 생성.
     */
    public LedgerPolicy withStalenessWindow(Duration stalenessWindow) {
        return new LedgerPolicy(stalenessWindow, minVotingPeriod, maxVotingPeriod, defaultBounds);
    }

    /**
     * 투표 기간 범위만 변경한 새 인스턴스 생성.
     */
    public LedgerPolicy withVotingPeriod(Duration minVotingPeriod, Duration maxVotingPeriod) {
        return new LedgerPolicy(stalenessWindow, minVotingPeriod, maxVotingPeriod, defaultBounds);
    }

    /**
     * defaultBounds만 변경한 새 인스턴스 생성.
     */
    public LedgerPolicy withDefaultBounds(TelemetryBounds defaultBounds) {
        return new LedgerPolicy(stalenessWindow, minVotingPeriod, maxVotingPeriod, defaultBounds);
    }

    public boolean isVotingPeriodAllowed(Duration period) {
        return period.compareTo(minVotingPeriod) >= 0 && period.compareTo(maxVotingPeriod) <= 0;
    }
}
