package com.pharbit.ledger.core.outcome;

/**
 * 저장 직전 상태에서 구조적 불변식 위반이 감지되었음을 나타내는 치명적 예외.
 *
 * <p>명령 검증이 올바르다면 발생하지 않아야 하며, 이전 버그를 의미합니다.
 * 엔진은 이 예외를 받으면 이후 모든 명령을 거부합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public class LedgerInvariantViolation extends RuntimeException {

    private final String invariant;

    public LedgerInvariantViolation(String invariant, String message) {
        super(invariant + ": " + message);
        this.invariant = invariant;
    }

    public String getInvariant() {
        return invariant;
    }
}
