package com.pharbit.ledger.core.model;

/**
 * 규정 준수 점검 상태.
 *
 * <p>상태 간 전이 그래프는 없습니다. 재검토 흐름이 비선형이므로 어떤 상태에서든 다른 상태로 바꿀 수 있습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public enum ComplianceStatus {
    PENDING,
    PASSED,
    FAILED,
    REQUIRES_ATTENTION,
    UNDER_REVIEW
}
