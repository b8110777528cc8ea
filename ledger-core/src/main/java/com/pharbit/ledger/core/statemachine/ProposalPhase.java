package com.pharbit.ledger.core.statemachine;

/**
 * 거버넌스 제안 단계.
 *
 * <p>OPEN → CLOSED_PENDING_EXECUTION → EXECUTED. 단계는 저장되지 않고
 * 마감 시각과 실행 여부로부터 매번 계산됩니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public enum ProposalPhase {

    /** 마감 전, 투표 가능 */
    OPEN,

    /** 마감 후, 실행 대기 */
    CLOSED_PENDING_EXECUTION,

    /** 실행 완료 (종료) */
    EXECUTED;

    public boolean isTerminal() {
        return this == EXECUTED;
    }
}
