package com.pharbit.ledger.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 불변 감사 기록. 정정은 수정이 아니라 새 항목 추가로만 이루어집니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record AuditEntry(
    BatchId batchId,
    int sequence,
    Identity auditor,
    String auditType,
    String findings,
    String recommendations,
    String result,
    List<String> evidence,
    Instant createdAt
) {

    public AuditEntry {
        if (batchId == null || auditor == null || createdAt == null) {
            throw new IllegalArgumentException("AuditEntry fields cannot be null (batchId: " + batchId + ")");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (auditType == null || auditType.isBlank()) {
            throw new IllegalArgumentException("auditType cannot be null or blank");
        }
        findings = findings == null ? "" : findings;
        recommendations = recommendations == null ? "" : recommendations;
        result = result == null ? "" : result;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
