package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.ApprovalId;
import com.pharbit.ledger.core.model.RegulatoryApproval;

/**
 * 규제 승인 회수 (REGULATOR 전용).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RevokeApproval(
    ApprovalId approvalId,
    String reason
) implements Command<RegulatoryApproval> {

    public RevokeApproval {
        if (approvalId == null) {
            throw new IllegalArgumentException("approvalId cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.REVOKE_APPROVAL;
    }
}
