package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.BatchId;

import java.util.List;

/**
 * 불변 감사 기록 추가 (AUDITOR 전용).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RecordAuditTrail(
    BatchId batchId,
    String auditType,
    String findings,
    String recommendations,
    String result,
    List<String> evidence
) implements Command<AuditEntry> {

    public RecordAuditTrail {
        if (batchId == null) {
            throw new IllegalArgumentException("batchId cannot be null");
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public CommandType type() {
        return CommandType.RECORD_AUDIT_TRAIL;
    }
}
