package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.RegulatoryApproval;

import java.time.Instant;

/**
 * 의약품 코드에 대한 규제 승인 등록 (REGULATOR 전용).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record GrantApproval(
    String drugCode,
    String approvalNumber,
    String regulatoryBody,
    Instant approvalDate,
    Instant expiryDate,
    String conditions
) implements Command<RegulatoryApproval> {

    public GrantApproval {
        if (approvalDate == null || expiryDate == null) {
            throw new IllegalArgumentException("approvalDate, expiryDate cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.GRANT_APPROVAL;
    }
}
