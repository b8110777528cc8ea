package com.pharbit.ledger.core.outcome;

/**
 * 명령 거부 사유 분류.
 *
 * <p>{@code retryable}은 다른 명령이 먼저 적용되어 레저 상태가 바뀌면
 * 같은 명령의 재제출이 성공할 수 있는지를 나타냅니다.
 * 입력값 자체가 잘못된 경우(BAD_INPUT 등)는 재제출해도 성공하지 않습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 역할/권한 부족 */
    UNAUTHORIZED(true),

    /** 참조 엔티티 없음 */
    NOT_FOUND(true),

    /** Stakeholder Directory에 등록되지 않은 Identity */
    NOT_REGISTERED(true),

    /** 호출자가 현재 보관자가 아님 */
    NOT_CUSTODIAN(true),

    /** 잘못된 형식 또는 범위 밖 파라미터 */
    BAD_INPUT(false),

    /** 상태 그래프 위반 */
    INVALID_TRANSITION(false),

    /** 고유성 위반 */
    ALREADY_EXISTS(false),

    /** 이미 등록된 Identity */
    ALREADY_REGISTERED(false),

    /** 이미 투표한 Owner */
    ALREADY_VOTED(false),

    /** 허용 시간 창 밖의 타임스탬프 */
    STALE_DATA(false),

    /** 투표/실행 시간 창 밖 */
    VOTING_CLOSED(true),

    /** 제안 없음 */
    PROPOSAL_NOT_FOUND(false),

    /** Owner 추가/제거 불가 */
    INVALID_OWNER(false),

    /** 정족수 범위 위반 */
    INVALID_QUORUM(false),

    /** 인덱스 범위 밖 */
    OUT_OF_BOUNDS(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
