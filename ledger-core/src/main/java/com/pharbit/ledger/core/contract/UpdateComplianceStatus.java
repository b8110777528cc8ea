package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.ComplianceRecordId;
import com.pharbit.ledger.core.model.ComplianceStatus;

/**
 * 규정 준수 기록 상태 제자리 갱신 (INSPECTOR/AUDITOR/REGULATOR). updatedNotes가 null이면 기존 notes 유지.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record UpdateComplianceStatus(
    ComplianceRecordId recordId,
    ComplianceStatus newStatus,
    boolean passed,
    String updatedNotes
) implements Command<ComplianceRecord> {

    public UpdateComplianceStatus {
        if (recordId == null || newStatus == null) {
            throw new IllegalArgumentException("recordId, newStatus cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.UPDATE_COMPLIANCE_STATUS;
    }
}
