package com.pharbit.ledger.core.model;

import java.time.Instant;

/**
 * 의약품 코드별 규제 승인.
 *
 * <p>승인은 회수(revoke)될 수 있지만 삭제되지 않습니다.
 * 승인 유효 여부는 {@link #isEffectiveAt(Instant)}로 판정합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RegulatoryApproval(
    ApprovalId id,
    String drugCode,
    String approvalNumber,
    String regulatoryBody,
    Instant approvalDate,
    Instant expiryDate,
    String conditions,
    Identity grantedBy,
    boolean revoked,
    String revocationReason
) {

    public RegulatoryApproval {
        if (id == null || grantedBy == null || approvalDate == null || expiryDate == null) {
            throw new IllegalArgumentException("RegulatoryApproval fields cannot be null (id: " + id + ")");
        }
        if (drugCode == null || drugCode.isBlank()) {
            throw new IllegalArgumentException("drugCode cannot be null or blank");
        }
        if (approvalNumber == null || approvalNumber.isBlank()) {
            throw new IllegalArgumentException("approvalNumber cannot be null or blank");
        }
        regulatoryBody = regulatoryBody == null ? "" : regulatoryBody;
        conditions = conditions == null ? "" : conditions;
        revocationReason = revocationReason == null ? "" : revocationReason;
    }

    /**
     * 주어진 시각에 승인이 유효한지 확인.
     *
     * @param now 기준 시각
     * @return 회수되지 않았고 approvalDate ≤ now &lt; expiryDate 이면 true
     */
    public boolean isEffectiveAt(Instant now) {
        return !revoked && !now.isBefore(approvalDate) && now.isBefore(expiryDate);
    }

    public RegulatoryApproval revoke(String reason) {
        return new RegulatoryApproval(id, drugCode, approvalNumber, regulatoryBody, approvalDate,
            expiryDate, conditions, grantedBy, true, reason);
    }
}
