package com.pharbit.ledger.core.model;

import java.time.Instant;

/**
 * Stakeholder Directory의 조직 기록.
 *
 * <p>Registrar만 생성/수정할 수 있으며, 삭제되지 않고 비활성화만 됩니다.</p>
 *
 * @param identity 대상 Identity
 * @param name 표시 이름
 * @param role 등록 시 지정한 조직 역할
 * @param kycCompleted KYC 완료 여부
 * @param kycReference KYC 증빙 참조 (null 허용)
 * @param active 활성 여부
 * @param registeredAt 등록 시각
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record StakeholderRecord(
    Identity identity,
    String name,
    Role role,
    boolean kycCompleted,
    String kycReference,
    boolean active,
    Instant registeredAt
) {

    public StakeholderRecord {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (registeredAt == null) {
            throw new IllegalArgumentException("registeredAt cannot be null");
        }
    }

    /**
     * 신규 등록 기록 생성 (KYC 미완료, 활성 상태).
     */
    public static StakeholderRecord registered(Identity identity, String name, Role role, Instant at) {
        return new StakeholderRecord(identity, name, role, false, null, true, at);
    }

    public StakeholderRecord withKyc(boolean completed, String reference) {
        return new StakeholderRecord(identity, name, role, completed, reference, active, registeredAt);
    }

    public StakeholderRecord withActive(boolean active) {
        return new StakeholderRecord(identity, name, role, kycCompleted, kycReference, active, registeredAt);
    }
}
