package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;

import java.util.List;

/**
 * 규정 준수 점검 기록 추가 (INSPECTOR/AUDITOR). 초기 상태는 PENDING.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record AddComplianceCheck(
    BatchId batchId,
    String checkType,
    String notes,
    String findings,
    String correctiveActions,
    List<String> evidence
) implements Command<ComplianceRecord> {

    public AddComplianceCheck {
        if (batchId == null) {
            throw new IllegalArgumentException("batchId cannot be null");
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public CommandType type() {
        return CommandType.ADD_COMPLIANCE_CHECK;
    }
}
