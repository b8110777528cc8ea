package com.pharbit.ledger.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 배치별 규정 준수 점검 기록.
 *
 * <p>Batch를 제외하면 생성 이후 값이 바뀌는 유일한 엔티티입니다.
 * 상태(status, passed, notes)는 교체가 아니라 제자리 갱신됩니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record ComplianceRecord(
    ComplianceRecordId id,
    String checkType,
    ComplianceStatus status,
    boolean passed,
    Identity auditor,
    String notes,
    String findings,
    String correctiveActions,
    List<String> evidence,
    Instant createdAt,
    Identity updatedBy,
    Instant updatedAt
) {

    public ComplianceRecord {
        if (id == null || status == null || auditor == null || createdAt == null
            || updatedBy == null || updatedAt == null) {
            throw new IllegalArgumentException("ComplianceRecord fields cannot be null (id: " + id + ")");
        }
        if (checkType == null || checkType.isBlank()) {
            throw new IllegalArgumentException("checkType cannot be null or blank");
        }
        notes = notes == null ? "" : notes;
        findings = findings == null ? "" : findings;
        correctiveActions = correctiveActions == null ? "" : correctiveActions;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public BatchId batchId() {
        return id.batchId();
    }

    /**
     * 상태 갱신본 생성. updatedNotes가 null이면 기존 notes 유지.
     */
    public ComplianceRecord withStatus(ComplianceStatus newStatus, boolean newPassed, String updatedNotes,
                                       Identity by, Instant at) {
        return new ComplianceRecord(id, checkType, newStatus, newPassed, auditor,
            updatedNotes == null ? notes : updatedNotes,
            findings, correctiveActions, evidence, createdAt, by, at);
    }
}
