package com.pharbit.ledger.core.model;

/**
 * 제안이 통과되어 실행될 때 함께 적용되는 관리 작업.
 *
 * <p>실행 결과가 통과(passed)인 경우에만, 제안 실행과 같은 명령 안에서 원자적으로 적용됩니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public sealed interface ProposalAction
    permits NoAction, GrantRoleAction, RevokeRoleAction, UpdateBoundsAction {

    /**
     * 이벤트 delta에 기록할 요약 문자열.
     */
    String summary();

    static ProposalAction none() {
        return NoAction.INSTANCE;
    }
}
