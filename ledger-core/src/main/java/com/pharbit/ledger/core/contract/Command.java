package com.pharbit.ledger.core.contract;

/**
 * 레저 상태를 변경하는 명령.
 *
 * <p>명령은 타입이 지정된 파라미터만 담는 불변 record이며, 호출자와 시각은
 * {@link Envelope}가 제공합니다. 컴팩트 생성자는 null만 검사하고,
 * 값의 의미 검증(빈 문자열, 범위 등)은 리듀서에서 BAD_INPUT으로 거부합니다.</p>
 *
 * @param <R> 성공 시 반환 값 타입
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public sealed interface Command<R> permits
    GrantRole, RevokeRole,
    RegisterStakeholder, SetKyc, SetActive,
    CreateBatch, UpdateStatus, DestroyBatch, TransferCustody,
    SetTelemetryBounds, SetBatchBounds, BindSensor, RecordTelemetry,
    AddComplianceCheck, UpdateComplianceStatus, RecordAuditTrail, GrantApproval, RevokeApproval,
    AddOwner, RemoveOwner, SetQuorum, CreateProposal, Vote, ExecuteProposal {

    /**
     * 명령 종류.
     *
     * @return CommandType
     */
    CommandType type();
}
