package com.pharbit.ledger.core.contract;

/**
 * 명령 종류. 이벤트 피드에 그대로 기록됩니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public enum CommandType {

    // Access Registry
    GRANT_ROLE,
    REVOKE_ROLE,

    // Stakeholder Directory
    REGISTER_STAKEHOLDER,
    SET_KYC,
    SET_ACTIVE,

    // Batch Ledger
    CREATE_BATCH,
    UPDATE_STATUS,
    DESTROY_BATCH,
    TRANSFER_CUSTODY,

    // Telemetry Validator
    SET_TELEMETRY_BOUNDS,
    SET_BATCH_BOUNDS,
    BIND_SENSOR,
    RECORD_TELEMETRY,

    // Compliance & Audit
    ADD_COMPLIANCE_CHECK,
    UPDATE_COMPLIANCE_STATUS,
    RECORD_AUDIT_TRAIL,
    GRANT_APPROVAL,
    REVOKE_APPROVAL,

    // Governance
    ADD_OWNER,
    REMOVE_OWNER,
    SET_QUORUM,
    CREATE_PROPOSAL,
    VOTE,
    EXECUTE_PROPOSAL
}
