package com.pharbit.ledger.adapter.runner;

import com.pharbit.ledger.core.transition.LedgerPolicy;

/**
 * SerializingLedgerEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>lockStripes: 엔티티 잠금 스트라이프 수 (기본 64)</li>
 *   <li>policy: 리듀서 정책 (기본 {@link LedgerPolicy#LedgerPolicy()})</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>서로 다른 배치에 대한 동시 명령이 많으면 lockStripes 증가 (64 → 256)</li>
 *   <li>lockStripes = 1 이면 모든 쓰기 명령이 하나씩 처리됨 (디버깅용)</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 * @param lockStripes 잠금 스트라이프 수 (1 이상)
 * @param policy 리듀서 정책
 */
public record LedgerEngineConfig(
    int lockStripes,
    LedgerPolicy policy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: lockStripes=64, policy=기본 정책</p>
     */
    public LedgerEngineConfig() {
        this(64, new LedgerPolicy());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LedgerEngineConfig {
        if (lockStripes <= 0) {
            throw new IllegalArgumentException(
                "lockStripes must be positive (current: " + lockStripes + ")"
            );
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
    }

    /**
     * lockStripes만 변경한 새 인스턴스 생성.
     */
    public LedgerEngineConfig withLockStripes(int lockStripes) {
        return new LedgerEngineConfig(lockStripes, policy);
    }

    /**
     * policy만 변경한 새 인스턴스 생성.
     */
    public LedgerEngineConfig withPolicy(LedgerPolicy policy) {
        return new LedgerEngineConfig(lockStripes, policy);
    }
}
