package com.pharbit.ledger.core.statemachine;

/**
 * 배치 상태.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * PRODUCED → IN_TRANSIT → AT_DISTRIBUTOR → AT_PHARMACY → DISPENSED
 *     (비종료 상태 어디서든) → RECALLED | EXPIRED
 * RECALLED | EXPIRED → DESTROYED (폐기 명령 전용)
 * </pre>
 *
 * <p><strong>종료 상태:</strong> DISPENSED, RECALLED, EXPIRED, DESTROYED.
 * 종료 상태에서는 상태 변경 명령이 모두 거부됩니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public enum BatchStatus {

    /** 생산 완료, 생산자 보관 */
    PRODUCED,

    /** 운송 중 */
    IN_TRANSIT,

    /** 유통사 도착 */
    AT_DISTRIBUTOR,

    /** 약국 도착 */
    AT_PHARMACY,

    /** 조제 완료 (종료) */
    DISPENSED,

    /** 회수 (종료, 폐기 가능) */
    RECALLED,

    /** 유효기간 만료 (종료, 폐기 가능) */
    EXPIRED,

    /** 폐기 (종료) */
    DESTROYED;

    /**
     * 종료 상태 여부 확인.
     *
     * @return DISPENSED, RECALLED, EXPIRED, DESTROYED이면 true
     */
    public boolean isTerminal() {
        return this == DISPENSED || this == RECALLED || this == EXPIRED || this == DESTROYED;
    }
}
